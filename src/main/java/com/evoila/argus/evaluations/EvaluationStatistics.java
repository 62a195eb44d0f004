package com.evoila.argus.evaluations;

import com.evoila.argus.evaluations.ScoreStatistics.ScoreBucket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Score statistics computed from returned datapoint rows.
 *
 * <p>Buckets start at {@code min(0, lowest score)} and end at the highest score, split into ten
 * equal widths. When every score is the same value, all of them land in the last bucket.
 */
public final class EvaluationStatistics {

  static final int BUCKET_COUNT = 10;
  private static final double DEFAULT_LOWER_BOUND = 0.0;

  private EvaluationStatistics() {
    // Utility class - prevent instantiation
  }

  /**
   * Statistics for every score name that appears in the rows.
   *
   * @param rows Rows whose {@code scores} column is a decoded JSON object
   * @return Score name to statistics, sorted by name
   */
  public static Map<String, ScoreStatistics> compute(List<Map<String, Object>> rows) {
    TreeSet<String> names = new TreeSet<>();
    for (Map<String, Object> row : rows) {
      scoresOf(row).keySet().forEach(name -> names.add(String.valueOf(name)));
    }
    Map<String, ScoreStatistics> statistics = new TreeMap<>();
    for (String name : names) {
      List<Double> values = valuesOf(rows, name);
      statistics.put(name, new ScoreStatistics(average(values), distribution(values)));
    }
    return statistics;
  }

  static List<Double> valuesOf(List<Map<String, Object>> rows, String scoreName) {
    List<Double> values = new ArrayList<>();
    for (Map<String, Object> row : rows) {
      Object value = scoresOf(row).get(scoreName);
      if (value instanceof Number number && !Double.isNaN(number.doubleValue())) {
        values.add(number.doubleValue());
      }
    }
    return values;
  }

  static double average(List<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
  }

  static List<ScoreBucket> distribution(List<Double> values) {
    List<ScoreBucket> buckets = new ArrayList<>(BUCKET_COUNT);
    if (values.isEmpty()) {
      for (int i = 0; i < BUCKET_COUNT; i++) {
        buckets.add(
            new ScoreBucket((double) i / BUCKET_COUNT, (double) (i + 1) / BUCKET_COUNT, 0));
      }
      return buckets;
    }

    double lowerBound = Math.min(Collections.min(values), DEFAULT_LOWER_BOUND);
    double upperBound = Collections.max(values);
    if (lowerBound == upperBound) {
      for (int i = 0; i < BUCKET_COUNT; i++) {
        int count = i == BUCKET_COUNT - 1 ? values.size() : 0;
        buckets.add(new ScoreBucket(lowerBound, upperBound, count));
      }
      return buckets;
    }

    double step = (upperBound - lowerBound) / BUCKET_COUNT;
    for (int i = 0; i < BUCKET_COUNT; i++) {
      boolean last = i == BUCKET_COUNT - 1;
      double from = lowerBound + i * step;
      double to = last ? upperBound : lowerBound + (i + 1) * step;
      int count =
          (int)
              values.stream()
                  .filter(v -> v >= from && (last ? v <= to : v < to))
                  .count();
      buckets.add(new ScoreBucket(from, to, count));
    }
    return buckets;
  }

  private static Map<?, ?> scoresOf(Map<String, Object> row) {
    return row.get(EvaluationQueries.SCORES_COLUMN) instanceof Map<?, ?> scores
        ? scores
        : Map.of();
  }
}
