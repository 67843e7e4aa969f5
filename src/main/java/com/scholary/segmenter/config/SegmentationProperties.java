package com.scholary.segmenter.config;

import com.scholary.segmenter.segment.SegmentBuilderOptions;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcript segmentation.
 *
 * <p>Loaded from the {@code segmentation} prefix in application.yml.
 */
@ConfigurationProperties(prefix = "segmentation")
@Validated
public record SegmentationProperties(@PositiveOrZero Long maxGapMs) {

  // Provide defaults
  public SegmentationProperties {
    if (maxGapMs == null) {
      maxGapMs = SegmentBuilderOptions.DEFAULT_MAX_GAP_MS;
    }
  }

  public SegmentBuilderOptions toBuilderOptions() {
    return new SegmentBuilderOptions(maxGapMs);
  }
}
