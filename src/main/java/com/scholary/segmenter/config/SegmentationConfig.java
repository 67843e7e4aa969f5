package com.scholary.segmenter.config;

import com.scholary.segmenter.segment.SegmentBuilderOptions;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for segmentation beans.
 *
 * <p>Enables {@link SegmentationProperties} and exposes the default builder options derived from
 * them.
 */
@Configuration
@EnableConfigurationProperties(SegmentationProperties.class)
public class SegmentationConfig {

  @Bean
  public SegmentBuilderOptions segmentBuilderOptions(SegmentationProperties properties) {
    return properties.toBuilderOptions();
  }
}
