package com.scholary.segmenter.segment;

import java.util.Objects;

/**
 * A single recognized word as delivered by the recognizer, with its tentative speaker.
 *
 * <p>Timestamps are milliseconds on the session timeline. Frames are not validated here: ordering
 * and duration are upstream contracts checked by {@link FrameOrderValidator}.
 *
 * @param text recognized token, may be empty
 * @param startMs start offset in milliseconds
 * @param endMs end offset in milliseconds
 * @param channel audio source or diarization track
 * @param isFinal whether the recognizer has committed to this word
 * @param identity tentative speaker, or {@code null} when unknown
 */
public record WordFrame(
    String text, long startMs, long endMs, int channel, boolean isFinal, SpeakerIdentity identity) {

  public WordFrame {
    Objects.requireNonNull(text, "text must not be null");
  }

  public static WordFrame interim(String text, long startMs, long endMs, int channel) {
    return new WordFrame(text, startMs, endMs, channel, false, null);
  }

  public static WordFrame committed(String text, long startMs, long endMs, int channel) {
    return new WordFrame(text, startMs, endMs, channel, true, null);
  }

  public WordFrame withIdentity(SpeakerIdentity identity) {
    return new WordFrame(text, startMs, endMs, channel, isFinal, identity);
  }

  public long durationMs() {
    return endMs - startMs;
  }
}
