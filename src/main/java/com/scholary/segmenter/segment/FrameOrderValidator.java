package com.scholary.segmenter.segment;

import com.scholary.segmenter.segment.FrameOrderException.Violation;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Checks that a frame stream honours the ordering contract segmentation relies on.
 *
 * <p>Rules, checked per frame in stream order:
 *
 * <ul>
 *   <li>{@code endMs >= startMs}
 *   <li>{@code startMs} is not earlier than the previous frame's, across all channels
 * </ul>
 *
 * <p>Equal start times are legal, including across channels.
 */
@Component
public class FrameOrderValidator {

  /**
   * Validate a complete frame sequence.
   *
   * @param frames the frames to check
   * @throws FrameOrderException at the first offending frame
   */
  public void validate(List<WordFrame> frames) {
    Objects.requireNonNull(frames, "frames must not be null");
    WordFrame previous = null;
    for (int i = 0; i < frames.size(); i++) {
      WordFrame frame = frames.get(i);
      check(previous, frame, i);
      previous = frame;
    }
  }

  /**
   * Validate one step of a stream.
   *
   * @param previous the previously accepted frame, or {@code null} at the start of the stream
   * @param next the candidate frame
   * @param index position of {@code next} in the stream
   * @throws FrameOrderException if {@code next} breaks the contract
   */
  public void check(WordFrame previous, WordFrame next, int index) {
    Objects.requireNonNull(next, "frame must not be null");
    if (next.endMs() < next.startMs()) {
      throw new FrameOrderException(
          index,
          Violation.NEGATIVE_DURATION,
          String.format(
              "Frame %d ends before it starts: start=%dms, end=%dms",
              index, next.startMs(), next.endMs()));
    }
    if (previous != null && next.startMs() < previous.startMs()) {
      throw new FrameOrderException(
          index,
          Violation.START_REGRESSION,
          String.format(
              "Frame %d starts at %dms, before previous frame start %dms (channel %d)",
              index, next.startMs(), previous.startMs(), next.channel()));
    }
  }
}
