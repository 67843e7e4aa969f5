package com.scholary.segmenter.segment;

/**
 * Tunables for segment building.
 *
 * @param maxGapMs largest silence, in milliseconds, between the last word of the open segment and
 *     the next word for that word to extend the segment instead of starting a new one
 */
public record SegmentBuilderOptions(long maxGapMs) {

  public static final long DEFAULT_MAX_GAP_MS = 2000;

  public static final SegmentBuilderOptions DEFAULTS = new SegmentBuilderOptions(DEFAULT_MAX_GAP_MS);

  public SegmentBuilderOptions {
    if (maxGapMs < 0) {
      throw new IllegalArgumentException("maxGapMs cannot be negative: " + maxGapMs);
    }
  }
}
