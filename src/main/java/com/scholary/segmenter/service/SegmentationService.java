package com.scholary.segmenter.service;

import com.scholary.segmenter.logging.StructuredLogger;
import com.scholary.segmenter.segment.FrameOrderException;
import com.scholary.segmenter.segment.FrameOrderValidator;
import com.scholary.segmenter.segment.ProtoSegment;
import com.scholary.segmenter.segment.SegmentAccumulator;
import com.scholary.segmenter.segment.SegmentBuilder;
import com.scholary.segmenter.segment.SegmentBuilderOptions;
import com.scholary.segmenter.segment.WordFrame;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for segmenting recognizer output.
 *
 * <p>Frames are checked against the ordering contract here, at the pipeline boundary, so the
 * segment builder itself stays total and side-effect free. Two modes are offered:
 *
 * <ul>
 *   <li>Batch: validate and segment a complete frame history in one call
 *   <li>Live: open a {@link LiveSegmentation} and feed frames as they arrive
 * </ul>
 */
@Service
public class SegmentationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentationService.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final FrameOrderValidator frameOrderValidator;
  private final SegmentBuilder segmentBuilder;

  public SegmentationService(
      FrameOrderValidator frameOrderValidator, SegmentBuilder segmentBuilder) {
    this.frameOrderValidator = frameOrderValidator;
    this.segmentBuilder = segmentBuilder;
  }

  /**
   * Validate and segment a complete frame history with the configured options.
   *
   * @param frames frames in stream order
   * @return segments in output order
   * @throws FrameOrderException if the frames break the ordering contract
   */
  public List<ProtoSegment> segment(List<WordFrame> frames) {
    return segment(frames, segmentBuilder.defaultOptions());
  }

  /**
   * Validate and segment a complete frame history.
   *
   * @param frames frames in stream order
   * @param options options for this call
   * @return segments in output order
   * @throws FrameOrderException if the frames break the ordering contract
   */
  public List<ProtoSegment> segment(List<WordFrame> frames, SegmentBuilderOptions options) {
    Objects.requireNonNull(frames, "frames must not be null");
    long startNanos = System.nanoTime();

    try {
      frameOrderValidator.validate(frames);
    } catch (FrameOrderException e) {
      structuredLogger.logOrderViolation(
          e.getFrameIndex(), e.getViolation().name(), e.getMessage());
      throw e;
    }

    List<ProtoSegment> segments = segmentBuilder.buildSegments(frames, options);

    long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
    structuredLogger.logSegmentationCompleted(
        frames.size(),
        segments.size(),
        countChannels(frames),
        countInterimSegments(segments),
        elapsedMs);
    return segments;
  }

  /** Open a live session using the configured options. */
  public LiveSegmentation openLiveSession() {
    return openLiveSession(segmentBuilder.defaultOptions());
  }

  /**
   * Open a live session that validates and folds frames one at a time.
   *
   * @param options options for the session
   * @return a new, empty session
   */
  public LiveSegmentation openLiveSession(SegmentBuilderOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    String sessionId = UUID.randomUUID().toString();
    structuredLogger.logLiveSessionOpened(sessionId, options.maxGapMs());
    return new LiveSegmentation(
        sessionId, new SegmentAccumulator(options), frameOrderValidator, structuredLogger);
  }

  private int countChannels(List<WordFrame> frames) {
    return (int) frames.stream().mapToInt(WordFrame::channel).distinct().count();
  }

  private int countInterimSegments(List<ProtoSegment> segments) {
    return (int) segments.stream().filter(ProtoSegment::hasInterimWords).count();
  }
}
