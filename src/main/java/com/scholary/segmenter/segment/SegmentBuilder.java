package com.scholary.segmenter.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groups an ordered stream of word frames into speaker-attributed segments.
 *
 * <p>Strategy:
 *
 * <ul>
 *   <li>Interim words reuse the key of the segment currently open on their channel
 *   <li>Final words derive their key from their own speaker identity
 *   <li>A word extends the last segment only if keys match and the gap is within the threshold
 * </ul>
 *
 * <p>This is a pure function of its input: the same frames and options always give the same
 * segments, and running it over a growing frame history is equivalent to feeding a {@link
 * SegmentAccumulator} frame by frame.
 */
@Component
public class SegmentBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentBuilder.class);

  private final SegmentBuilderOptions defaultOptions;

  public SegmentBuilder(SegmentBuilderOptions defaultOptions) {
    this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions must not be null");
  }

  /**
   * Build segments using the configured default options.
   *
   * @param frames frames in non-decreasing start order
   * @return segments in output order
   */
  public List<ProtoSegment> buildSegments(List<WordFrame> frames) {
    return buildSegments(frames, defaultOptions);
  }

  /**
   * Build segments with explicit options.
   *
   * @param frames frames in non-decreasing start order
   * @param options options for this call, or {@code null} for the defaults
   * @return segments in output order
   */
  public List<ProtoSegment> buildSegments(List<WordFrame> frames, SegmentBuilderOptions options) {
    Objects.requireNonNull(frames, "frames must not be null");
    if (frames.isEmpty()) {
      return List.of();
    }

    SegmentAccumulator accumulator =
        new SegmentAccumulator(options != null ? options : defaultOptions);
    for (WordFrame frame : frames) {
      accumulator.ingest(frame);
    }

    LOGGER.debug(
        "Built {} segments from {} frames (maxGap={}ms)",
        accumulator.segments().size(),
        frames.size(),
        accumulator.maxGapMs());
    return new ArrayList<>(accumulator.segments());
  }

  public SegmentBuilderOptions defaultOptions() {
    return defaultOptions;
  }
}
