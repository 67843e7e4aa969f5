package com.scholary.segmenter.service;

import com.scholary.segmenter.logging.StructuredLogger;
import com.scholary.segmenter.segment.FrameOrderException;
import com.scholary.segmenter.segment.FrameOrderValidator;
import com.scholary.segmenter.segment.ProtoSegment;
import com.scholary.segmenter.segment.SegmentAccumulator;
import com.scholary.segmenter.segment.WordFrame;
import java.util.List;

/**
 * Incremental segmentation over one frame stream.
 *
 * <p>Each frame is checked against the previously accepted one before it is folded in. A rejected
 * frame leaves the session untouched, so the caller can drop it and keep streaming.
 *
 * <p>Not thread-safe: callers must serialize {@link #ingest(WordFrame)}.
 */
public class LiveSegmentation {

  private final String sessionId;
  private final SegmentAccumulator accumulator;
  private final FrameOrderValidator frameOrderValidator;
  private final StructuredLogger structuredLogger;

  private WordFrame previous;
  private int acceptedFrames;

  LiveSegmentation(
      String sessionId,
      SegmentAccumulator accumulator,
      FrameOrderValidator frameOrderValidator,
      StructuredLogger structuredLogger) {
    this.sessionId = sessionId;
    this.accumulator = accumulator;
    this.frameOrderValidator = frameOrderValidator;
    this.structuredLogger = structuredLogger;
  }

  /**
   * Accept the next frame of the stream.
   *
   * @param frame the next frame
   * @return the segment the frame was placed in
   * @throws FrameOrderException if the frame breaks the ordering contract
   */
  public ProtoSegment ingest(WordFrame frame) {
    StructuredLogger.setSessionContext(sessionId);
    try {
      frameOrderValidator.check(previous, frame, acceptedFrames);
      ProtoSegment segment = accumulator.ingest(frame);
      previous = frame;
      acceptedFrames++;
      return segment;
    } catch (FrameOrderException e) {
      structuredLogger.logOrderViolation(
          e.getFrameIndex(), e.getViolation().name(), e.getMessage());
      throw e;
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  /** Segments so far, in output order. */
  public List<ProtoSegment> segments() {
    return accumulator.segments();
  }

  public int acceptedFrames() {
    return acceptedFrames;
  }

  public String sessionId() {
    return sessionId;
  }
}
