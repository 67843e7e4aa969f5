package com.scholary.segmenter.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of a single log call so log
 * shippers can index them, then removes them again.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a completed batch segmentation run. */
  public void logSegmentationCompleted(
      int frameCount, int segmentCount, int channelCount, int interimSegments, long elapsedMs) {
    try {
      MDC.put("event_type", "segmentation_completed");
      MDC.put("frame_count", String.valueOf(frameCount));
      MDC.put("segment_count", String.valueOf(segmentCount));
      MDC.put("channel_count", String.valueOf(channelCount));
      MDC.put("interim_segments", String.valueOf(interimSegments));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Segmentation completed: frames={}, segments={}, channels={}, interimSegments={}, took={}ms",
          frameCount,
          segmentCount,
          channelCount,
          interimSegments,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a frame rejected for breaking the ordering contract. */
  public void logOrderViolation(int frameIndex, String violation, String message) {
    try {
      MDC.put("event_type", "frame_order_violation");
      MDC.put("frame_index", String.valueOf(frameIndex));
      MDC.put("violation", violation);

      logger.warn(
          "Frame order violation: index={}, violation={}, message={}",
          frameIndex,
          violation,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a live session being opened. */
  public void logLiveSessionOpened(String sessionId, long maxGapMs) {
    try {
      MDC.put("event_type", "live_session_opened");
      MDC.put("maxGapMs", String.valueOf(maxGapMs));

      logger.debug("Live segmentation session opened: sessionId={}, maxGap={}ms", sessionId, maxGapMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set live session context in MDC. */
  public static void setSessionContext(String sessionId) {
    MDC.put("sessionId", sessionId);
  }

  /** Clear live session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("sessionId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("frame_count");
    MDC.remove("segment_count");
    MDC.remove("channel_count");
    MDC.remove("interim_segments");
    MDC.remove("elapsedMs");
    MDC.remove("frame_index");
    MDC.remove("violation");
    MDC.remove("maxGapMs");
  }
}
