package com.scholary.segmenter.segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A maximal run of words sharing one {@link SegmentKey}, with no gap above the configured
 * threshold between consecutive words.
 *
 * <p>The key is fixed when the segment is created. Words are only ever appended, and only by the
 * {@link SegmentAccumulator} that created the segment, so consumers see a read-only view.
 *
 * <p>A segment whose words are not all final may still be re-attributed on a later pass once
 * identity resolution settles. Check {@link #hasInterimWords()} before treating the key as
 * settled.
 */
public final class ProtoSegment {

  private final SegmentKey key;
  private final List<WordFrame> words = new ArrayList<>();
  private final List<WordFrame> wordsView = Collections.unmodifiableList(words);

  ProtoSegment(SegmentKey key, WordFrame firstWord) {
    this.key = Objects.requireNonNull(key, "key must not be null");
    this.words.add(Objects.requireNonNull(firstWord, "firstWord must not be null"));
  }

  public SegmentKey key() {
    return key;
  }

  /** Words in arrival order. Never empty. */
  public List<WordFrame> words() {
    return wordsView;
  }

  public WordFrame lastWord() {
    return words.get(words.size() - 1);
  }

  public long startMs() {
    return words.get(0).startMs();
  }

  public long endMs() {
    return lastWord().endMs();
  }

  public boolean hasInterimWords() {
    for (WordFrame word : words) {
      if (!word.isFinal()) {
        return true;
      }
    }
    return false;
  }

  void append(WordFrame word) {
    words.add(word);
  }

  @Override
  public String toString() {
    return "ProtoSegment[key=" + key + ", words=" + words.size() + ", range=" + startMs() + "-"
        + endMs() + "]";
  }
}
