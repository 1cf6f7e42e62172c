package com.ospicorp.growthcurves.growth.service;

import com.ospicorp.growthcurves.growth.model.GroupKey;
import com.ospicorp.growthcurves.growth.model.Observation;
import com.ospicorp.growthcurves.growth.model.ObservationRow;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Groups tidy observation rows by organism / experiment / replicate. Keys keep the order in
 * which they first appear; each group is sorted by time, keeping duplicate timestamps in
 * input order.
 */
public final class SeriesAssembler {
  private SeriesAssembler() {
  }

  public static Map<GroupKey, List<Observation>> assemble(List<ObservationRow> rows) {
    Map<GroupKey, List<Integer>> indexed = indexByGroup(rows);
    Map<GroupKey, List<Observation>> out = new LinkedHashMap<>(indexed.size());
    for (var e : indexed.entrySet()) {
      List<Observation> series = new ArrayList<>(e.getValue().size());
      for (int index : e.getValue()) {
        series.add(toObservation(rows.get(index)));
      }
      out.put(e.getKey(), series);
    }
    return out;
  }

  /** Row positions of each group, ordered by time. */
  public static Map<GroupKey, List<Integer>> indexByGroup(List<ObservationRow> rows) {
    validate(rows);
    Map<GroupKey, List<Integer>> groups = new LinkedHashMap<>();
    for (int i = 0; i < rows.size(); i++) {
      groups.computeIfAbsent(rows.get(i).groupKey(), k -> new ArrayList<>()).add(i);
    }
    Comparator<Integer> byTime = Comparator.comparingDouble(i -> rows.get(i).time());
    for (List<Integer> indices : groups.values()) {
      // List.sort is stable, so duplicate timestamps stay in input order
      indices.sort(byTime);
    }
    return groups;
  }

  static Observation toObservation(ObservationRow row) {
    return new Observation(row.time(), row.density());
  }

  static void validate(List<ObservationRow> rows) {
    if (rows == null) {
      throw new IllegalArgumentException("rows must be provided");
    }
    for (int i = 0; i < rows.size(); i++) {
      ObservationRow row = rows.get(i);
      if (row == null) {
        throw new IllegalArgumentException("row " + i + " is empty");
      }
      if (!StringUtils.hasText(row.organismId()) || !StringUtils.hasText(row.experimentId())
          || !StringUtils.hasText(row.replicateId())) {
        throw new IllegalArgumentException(
            "row " + i + ": organism_id, experiment_id and replicate_id must be provided");
      }
      Double time = row.time();
      if (time == null || !Double.isFinite(time) || time < 0d) {
        throw new IllegalArgumentException(
            "row " + i + ": time must be a finite value >= 0, got " + time);
      }
      Double density = row.density();
      if (density != null && (!Double.isFinite(density) || density < 0d)) {
        throw new IllegalArgumentException(
            "row " + i + ": density must be empty or a finite value >= 0, got " + density);
      }
    }
  }
}
