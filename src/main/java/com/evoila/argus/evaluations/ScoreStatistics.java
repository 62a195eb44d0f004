package com.evoila.argus.evaluations;

import java.util.List;

/**
 * Summary of one score across the datapoints of an evaluation.
 *
 * @param averageValue Mean of all numeric values, 0 when there are none
 * @param distribution Ten buckets covering the observed range
 */
public record ScoreStatistics(double averageValue, List<ScoreBucket> distribution) {

  /** A distribution bucket; the last bucket includes its upper bound. */
  public record ScoreBucket(double lowerBound, double upperBound, int count) {}
}
