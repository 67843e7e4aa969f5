package com.scholary.segmenter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.segmenter.segment.FrameOrderException;
import com.scholary.segmenter.segment.FrameOrderValidator;
import com.scholary.segmenter.segment.ProtoSegment;
import com.scholary.segmenter.segment.SegmentBuilder;
import com.scholary.segmenter.segment.SegmentBuilderOptions;
import com.scholary.segmenter.segment.SegmentKey;
import com.scholary.segmenter.segment.SpeakerIdentity;
import com.scholary.segmenter.segment.WordFrame;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SegmentationServiceTest {

  private SegmentationService service;

  @BeforeEach
  void setUp() {
    service =
        new SegmentationService(
            new FrameOrderValidator(), new SegmentBuilder(new SegmentBuilderOptions(500)));
  }

  @Test
  void segment_shouldUseConfiguredGap() {
    List<WordFrame> frames =
        List.of(WordFrame.committed("a", 0, 100, 0), WordFrame.committed("b", 700, 800, 0));

    assertThat(service.segment(frames)).hasSize(2);
    assertThat(service.segment(frames, SegmentBuilderOptions.DEFAULTS)).hasSize(1);
  }

  @Test
  void segment_shouldRejectOutOfOrderFrames() {
    List<WordFrame> frames =
        List.of(WordFrame.committed("a", 500, 600, 0), WordFrame.interim("b", 100, 200, 1));

    assertThatThrownBy(() -> service.segment(frames))
        .isInstanceOf(FrameOrderException.class)
        .hasMessageContaining("before previous frame start 500ms");
  }

  @Test
  void segment_shouldReturnEmptyForNoFrames() {
    assertThat(service.segment(List.of())).isEmpty();
  }

  @Test
  void liveSession_shouldFoldFramesIncrementally() {
    LiveSegmentation session = service.openLiveSession();

    session.ingest(WordFrame.committed("a", 0, 100, 0).withIdentity(SpeakerIdentity.ofHumanId("x")));
    session.ingest(WordFrame.interim("b", 150, 250, 0));
    ProtoSegment placed = session.ingest(WordFrame.committed("c", 260, 300, 1));

    assertThat(session.segments()).hasSize(2);
    assertThat(session.segments().get(0).words()).extracting(WordFrame::text).containsExactly("a", "b");
    assertThat(placed.key()).isEqualTo(SegmentKey.ofChannel(1));
    assertThat(session.acceptedFrames()).isEqualTo(3);
    assertThat(session.sessionId()).isNotBlank();
  }

  @Test
  void liveSession_shouldLeaveStateUntouchedOnRejectedFrame() {
    LiveSegmentation session = service.openLiveSession();
    session.ingest(WordFrame.committed("a", 1000, 1100, 0));

    assertThatThrownBy(() -> session.ingest(WordFrame.interim("late", 900, 950, 0)))
        .isInstanceOf(FrameOrderException.class)
        .extracting("frameIndex")
        .isEqualTo(1);

    assertThat(session.acceptedFrames()).isEqualTo(1);
    assertThat(session.segments()).hasSize(1);
    assertThat(session.segments().get(0).words()).hasSize(1);

    session.ingest(WordFrame.interim("next", 1200, 1300, 0));
    assertThat(session.segments().get(0).words()).extracting(WordFrame::text)
        .containsExactly("a", "next");
  }

  @Test
  void liveSession_shouldMatchBatchSegmentation() {
    List<WordFrame> frames =
        List.of(
            WordFrame.committed("0", 0, 100, 0).withIdentity(SpeakerIdentity.ofSpeakerIndex(0)),
            WordFrame.interim("1", 100, 200, 1),
            WordFrame.interim("2", 150, 250, 0),
            WordFrame.committed("3", 900, 1000, 0).withIdentity(SpeakerIdentity.ofSpeakerIndex(1)),
            WordFrame.interim("4", 1100, 1200, 0));

    List<ProtoSegment> batch = service.segment(frames);
    LiveSegmentation session = service.openLiveSession();
    frames.forEach(session::ingest);

    assertThat(session.segments()).extracting(ProtoSegment::key)
        .containsExactlyElementsOf(batch.stream().map(ProtoSegment::key).toList());
  }
}
