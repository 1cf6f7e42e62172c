package com.ospicorp.growthcurves.growth.controller;

import com.ospicorp.growthcurves.growth.model.AnnotatedRow;
import com.ospicorp.growthcurves.growth.model.CurveRow;
import com.ospicorp.growthcurves.growth.model.FitTableResponse;
import com.ospicorp.growthcurves.growth.model.ObservationTable;
import com.ospicorp.growthcurves.growth.service.GrowthAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Comparator;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/growth")
@Tag(name = "Growth")
public class GrowthController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;
  private static final String ERROR_DOCS_BASE = "https://docs.growth-curves.dev/errors/";

  private final GrowthAnalysisService svc;
  private final int defaultCurvePoints;
  private final int maxCurvePoints;

  public GrowthController(GrowthAnalysisService svc,
      @Value("${growth.curve.default-points:200}") int defaultCurvePoints,
      @Value("${growth.curve.max-points:10000}") int maxCurvePoints) {
    this.svc = svc;
    this.defaultCurvePoints = defaultCurvePoints;
    this.maxCurvePoints = maxCurvePoints;
  }

  @PostMapping(value = "/annotations", consumes = {"application/json", "text/csv"})
  @Operation(summary = "Annotate death phase",
      description = "Return the observation rows in input order with a death_phase flag marking "
          + "each group's sustained terminal decline.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Annotated rows",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = AnnotatedRow.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<AnnotatedRow>> annotations(@RequestBody ObservationTable table,
      @RequestParam(required = false)
          @Parameter(description = "Relative drop below the running maximum that counts as decline",
              example = "0.0") Double tolerance,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    validateTolerance(tolerance);
    MediaType contentType = selectMediaType(format, accept);
    return ResponseEntity.ok()
        .contentType(contentType)
        .body(svc.annotate(table.rows(), tolerance));
  }

  @PostMapping(value = "/fits", consumes = {"application/json", "text/csv"})
  @Operation(summary = "Fit logistic growth",
      description = "Fit r, K and N0 of the logistic growth law to each group's pre-death-phase "
          + "observations. Groups whose fit fails are reported with a failure reason.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Fit table",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = FitTableResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> fits(@RequestBody ObservationTable table,
      @RequestParam(required = false) Double tolerance,
      @RequestParam(name = "rate_scale", defaultValue = "1")
          @Parameter(description = "Factor applied to r, e.g. 24 for per-hour to per-day",
              example = "24") double rateScale,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    validateTolerance(tolerance);
    if (!Double.isFinite(rateScale) || rateScale <= 0d) {
      throw invalidParameter("Invalid rate_scale parameter. Must be a positive number.", 2002);
    }
    MediaType contentType = selectMediaType(format, accept);
    FitTableResponse response = svc.fitTable(table.rows(), tolerance, rateScale);
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE)
        ? response.fits()
        : response;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @PostMapping(value = "/curves", consumes = {"application/json", "text/csv"})
  @Operation(summary = "Reconstruct fitted curves",
      description = "Sample each converged group's fitted logistic curve on an evenly spaced "
          + "grid. The domain defaults to the group's observed time range and may extrapolate.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Sampled curves",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = CurveRow.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<CurveRow>> curves(@RequestBody ObservationTable table,
      @RequestParam(required = false) Double tolerance,
      @RequestParam(required = false) @Parameter(description = "Domain start", example = "0") Double start,
      @RequestParam(required = false) @Parameter(description = "Domain end", example = "48") Double end,
      @RequestParam(required = false) @Parameter(description = "Number of samples per group") Integer points,
      @RequestParam(required = false) @Parameter(description = "Spacing between samples") Double step,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    validateTolerance(tolerance);
    if (points != null && step != null) {
      throw invalidParameter("Provide either points or step, not both.", 2005);
    }
    if (points != null && (points < 1 || points > maxCurvePoints)) {
      throw invalidParameter(
          "Invalid points parameter. Supported range: 1-" + maxCurvePoints + ".", 2003);
    }
    if (step != null && (!Double.isFinite(step) || step <= 0d)) {
      throw invalidParameter("Invalid step parameter. Must be a positive number.", 2004);
    }
    if (start != null && end != null && start > end) {
      throw invalidParameter("Invalid domain. start must be before or equal to end.", 2006);
    }
    Integer effectivePoints = points == null && step == null ? defaultCurvePoints : points;
    MediaType contentType = selectMediaType(format, accept);
    return ResponseEntity.ok()
        .contentType(contentType)
        .body(svc.curves(table.rows(), tolerance, start, end, effectivePoints, step));
  }

  private static void validateTolerance(Double tolerance) {
    if (tolerance != null && (!Double.isFinite(tolerance) || tolerance < 0d || tolerance >= 1d)) {
      throw invalidParameter("Invalid tolerance parameter. Supported range: [0, 1).", 2001);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 2007);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}
