package com.scholary.segmenter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SegmenterApplication {

  public static void main(String[] args) {
    SpringApplication.run(SegmenterApplication.class, args);
  }
}
