package com.ospicorp.growthcurves.growth.controller;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.growthcurves.growth.model.ObservationRow;
import com.ospicorp.growthcurves.growth.model.ObservationTable;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * {@code text/csv} support for the growth endpoints: reads an {@link ObservationTable} with a
 * header row and writes any collection of flat row records, one column per property.
 * Empty density cells are read as missing values.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Object> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
    mapper.enable(CsvParser.Feature.EMPTY_STRING_AS_NULL);
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
    // extra columns such as plate or well ids are allowed and ignored
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return ObservationTable.class.isAssignableFrom(clazz)
        || Collection.class.isAssignableFrom(clazz);
  }

  @Override
  public boolean canRead(@NonNull Class<?> clazz, MediaType mediaType) {
    return ObservationTable.class.isAssignableFrom(clazz) && canRead(mediaType);
  }

  @Override
  public boolean canWrite(@NonNull Class<?> clazz, MediaType mediaType) {
    return Collection.class.isAssignableFrom(clazz) && canWrite(mediaType);
  }

  @Override
  @NonNull
  protected Object readInternal(@NonNull Class<?> clazz, @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    try (MappingIterator<ObservationRow> it = mapper.readerFor(ObservationRow.class)
        .with(schema)
        .readValues(inputMessage.getBody())) {
      List<ObservationRow> rows = it.readAll();
      return new ObservationTable(rows);
    } catch (IOException ex) {
      throw new HttpMessageNotReadableException(
          "Malformed observation CSV: " + ex.getMessage(), ex, inputMessage);
    }
  }

  @Override
  protected void writeInternal(@NonNull Object object, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Collection<?> rows = (Collection<?>) object;
    CsvSchema schema = determineSchema(rows);
    var writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      writer.write(row);
    }
    writer.flush();
  }

  private CsvSchema determineSchema(Collection<?> rows) {
    for (Object row : rows) {
      if (row != null) {
        return mapper.schemaFor(row.getClass()).withHeader();
      }
    }
    return CsvSchema.emptySchema();
  }
}
