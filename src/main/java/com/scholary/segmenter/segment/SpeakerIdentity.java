package com.scholary.segmenter.segment;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Tentative speaker attribution attached to a word before it reaches segmentation.
 *
 * <p>Either field may be absent. A {@code null} speaker index means the provider gave none, which
 * is distinct from a present index of {@code 0}.
 *
 * @param speakerIndex provider diarization index, or {@code null} when absent
 * @param humanId resolved human identifier, or {@code null} when absent
 */
public record SpeakerIdentity(Integer speakerIndex, String humanId) {

  public static SpeakerIdentity ofSpeakerIndex(int speakerIndex) {
    return new SpeakerIdentity(speakerIndex, null);
  }

  public static SpeakerIdentity ofHumanId(String humanId) {
    return new SpeakerIdentity(null, humanId);
  }

  public OptionalInt speakerIndexIfPresent() {
    return speakerIndex == null ? OptionalInt.empty() : OptionalInt.of(speakerIndex);
  }

  public Optional<String> humanIdIfPresent() {
    return Optional.ofNullable(humanId);
  }
}
