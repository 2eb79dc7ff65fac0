package com.scholary.watermark;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Batch image watermarking service. */
@SpringBootApplication
public class WatermarkBatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(WatermarkBatchApplication.class, args);
  }
}
