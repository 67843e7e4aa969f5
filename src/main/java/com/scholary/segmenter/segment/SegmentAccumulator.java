package com.scholary.segmenter.segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Running state of one segmentation pass, folded one frame at a time.
 *
 * <p>Two different notions of "last segment" are tracked and must stay separate:
 *
 * <ul>
 *   <li>the tail of the output list, the only segment a frame may ever extend
 *   <li>the most recent segment per channel, consulted only to pick a key for interim frames
 * </ul>
 *
 * <p>Because merging only looks at the global tail, a channel cannot extend one of its own earlier
 * segments once another channel's segment has been appended after it. Cross-talk always produces
 * alternating segments.
 *
 * <p>Not thread-safe. Frames must be ingested in non-decreasing start order; that contract is not
 * checked here (see {@link FrameOrderValidator}).
 */
public final class SegmentAccumulator {

  private final long maxGapMs;
  private final List<ProtoSegment> segments = new ArrayList<>();
  private final List<ProtoSegment> segmentsView = Collections.unmodifiableList(segments);
  private final Map<Integer, ProtoSegment> openByChannel = new HashMap<>();
  private long frameCount;

  public SegmentAccumulator() {
    this(SegmentBuilderOptions.DEFAULTS);
  }

  public SegmentAccumulator(SegmentBuilderOptions options) {
    this.maxGapMs = Objects.requireNonNull(options, "options must not be null").maxGapMs();
  }

  /**
   * Fold one frame into the running segments.
   *
   * @param frame the next frame in input order
   * @return the segment the frame ended up in, either the extended tail or a new segment
   */
  public ProtoSegment ingest(WordFrame frame) {
    Objects.requireNonNull(frame, "frame must not be null");
    frameCount++;

    SegmentKey key = resolveKey(frame);
    ProtoSegment last = segments.isEmpty() ? null : segments.get(segments.size() - 1);

    if (last != null && last.key().equals(key) && withinGap(last, frame)) {
      last.append(frame);
      openByChannel.put(frame.channel(), last);
      return last;
    }

    ProtoSegment created = new ProtoSegment(key, frame);
    segments.add(created);
    openByChannel.put(frame.channel(), created);
    return created;
  }

  /** Segments built so far, in output order. Live view, not a copy. */
  public List<ProtoSegment> segments() {
    return segmentsView;
  }

  /** Most recently created or extended segment on the channel, if any. */
  public Optional<ProtoSegment> openSegment(int channel) {
    return Optional.ofNullable(openByChannel.get(channel));
  }

  public long frameCount() {
    return frameCount;
  }

  public long maxGapMs() {
    return maxGapMs;
  }

  // Interim words stay attached to whatever is open on their channel; final words re-derive.
  private SegmentKey resolveKey(WordFrame frame) {
    if (!frame.isFinal()) {
      ProtoSegment open = openByChannel.get(frame.channel());
      if (open != null) {
        return open.key();
      }
    }
    return SegmentKey.fromIdentity(frame.channel(), frame.identity());
  }

  private boolean withinGap(ProtoSegment segment, WordFrame frame) {
    return frame.startMs() - segment.lastWord().endMs() <= maxGapMs;
  }
}
