package com.scholary.unlinkmkv.config;

import com.scholary.unlinkmkv.subtitle.PlayResolution;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for unlinking.
 *
 * <p>Controls where output and scratch files go, which edition is flattened and how subtitles are
 * treated.
 */
@ConfigurationProperties(prefix = "unlink")
@Validated
public record UnlinkProperties(
    @NotBlank String outDir,
    @NotBlank String tmpDir,
    @Min(1) int edition,
    boolean keepNonDefaultEditions,
    boolean ignoreSegmentStart,
    boolean chapters,
    boolean cleanup,
    @Valid @NotNull SubtitleProperties subtitles,
    @Positive int registryCacheSize,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record SubtitleProperties(
      boolean fix, @Positive Integer playResX, @Positive Integer playResY) {

    public PlayResolution playResolution() {
      return new PlayResolution(playResX, playResY);
    }
  }
}
