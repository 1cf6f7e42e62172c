package com.ospicorp.growthcurves.growth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request body of the growth endpoints. Serialized as a plain JSON array of rows, or read
 * from {@code text/csv} by the CSV converter.
 */
public record ObservationTable(List<ObservationRow> rows) {

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public ObservationTable {
    // null rows are kept so that validation can report them by position
    rows = rows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
  }

  @JsonValue
  @Override
  public List<ObservationRow> rows() {
    return rows;
  }
}
