package com.scholary.unlinkmkv.api;

import com.scholary.unlinkmkv.UnlinkException;
import com.scholary.unlinkmkv.config.UnlinkProperties;
import com.scholary.unlinkmkv.segment.SegmentRegistryCache;
import com.scholary.unlinkmkv.service.UnlinkPipeline;
import com.scholary.unlinkmkv.toolchain.Toolchain;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Dry-run endpoint: shows how a file would be reconstructed.
 *
 * <p>Useful for checking edition selection and split points before running a batch. Only chapter
 * reading and segment probing are performed.
 */
@RestController
@Tag(name = "Chapters", description = "Timeline preview")
public class ChapterPreviewController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChapterPreviewController.class);

  private final UnlinkPipeline pipeline;
  private final Toolchain toolchain;
  private final UnlinkProperties properties;

  public ChapterPreviewController(
      UnlinkPipeline pipeline, Toolchain toolchain, UnlinkProperties properties) {
    this.pipeline = pipeline;
    this.toolchain = toolchain;
    this.properties = properties;
  }

  @PostMapping("/api/chapters/preview")
  @Operation(
      summary = "Preview timeline",
      description =
          "Flatten the chapters of one file and show split points and parts without muxing")
  public ResponseEntity<ChapterPreviewResponse> preview(
      @Valid @RequestBody ChapterPreviewRequest request) {
    Path file = Paths.get(request.path()).toAbsolutePath().normalize();
    if (!Files.isRegularFile(file)) {
      return ResponseEntity.notFound().build();
    }

    try {
      SegmentRegistryCache registries =
          new SegmentRegistryCache(toolchain, properties.registryCacheSize());
      return pipeline
          .preview(file, registries)
          .map(preview -> ResponseEntity.ok(ChapterPreviewResponse.from(preview)))
          .orElse(ResponseEntity.noContent().build());

    } catch (UnlinkException e) {
      LOGGER.warn("Unable to preview {}: {}", file, e.getMessage());
      return ResponseEntity.unprocessableEntity().build();
    } catch (IOException e) {
      LOGGER.error("Failed to preview {}", file, e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }
}
