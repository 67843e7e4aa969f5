package com.scholary.segmenter.segment;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Identifies the speaker turn a word belongs to.
 *
 * <p>Keys compare by value: the channel must match and each optional component must be either
 * absent on both sides or present and equal on both. A present component never equals an absent
 * one, so {@code speakerIndex = 0} and "no speaker index" are different keys.
 */
public record SegmentKey(int channel, OptionalInt speakerIndex, Optional<String> humanId) {

  public SegmentKey {
    Objects.requireNonNull(speakerIndex, "speakerIndex must not be null, use OptionalInt.empty()");
    Objects.requireNonNull(humanId, "humanId must not be null, use Optional.empty()");
  }

  /** Key carrying only a channel. */
  public static SegmentKey ofChannel(int channel) {
    return new SegmentKey(channel, OptionalInt.empty(), Optional.empty());
  }

  /**
   * Derive a key from a word's tentative identity.
   *
   * <p>Only the components present on the identity are copied. A missing identity yields a
   * channel-only key.
   *
   * @param channel the word's channel
   * @param identity the word's identity, may be {@code null}
   * @return the derived key
   */
  public static SegmentKey fromIdentity(int channel, SpeakerIdentity identity) {
    if (identity == null) {
      return ofChannel(channel);
    }
    return new SegmentKey(channel, identity.speakerIndexIfPresent(), identity.humanIdIfPresent());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("SegmentKey[channel=").append(channel);
    speakerIndex.ifPresent(index -> sb.append(", speakerIndex=").append(index));
    humanId.ifPresent(id -> sb.append(", humanId=").append(id));
    return sb.append(']').toString();
  }
}
