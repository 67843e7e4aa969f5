package com.scholary.segmenter.segment;

/**
 * Exception thrown when a frame stream breaks the upstream ordering contract.
 *
 * <p>Segmentation assumes frames arrive in non-decreasing start order with non-negative duration.
 * Rather than guessing a correction for late or malformed frames, the boundary rejects them and
 * reports where the stream went wrong.
 */
public class FrameOrderException extends RuntimeException {

  /** Kind of contract violation. */
  public enum Violation {
    NEGATIVE_DURATION,
    START_REGRESSION
  }

  private final int frameIndex;
  private final Violation violation;

  public FrameOrderException(int frameIndex, Violation violation, String message) {
    super(message);
    this.frameIndex = frameIndex;
    this.violation = violation;
  }

  public FrameOrderException(int frameIndex, Violation violation, String message, Throwable cause) {
    super(message, cause);
    this.frameIndex = frameIndex;
    this.violation = violation;
  }

  /** Position of the offending frame in the stream. */
  public int getFrameIndex() {
    return frameIndex;
  }

  public Violation getViolation() {
    return violation;
  }
}
