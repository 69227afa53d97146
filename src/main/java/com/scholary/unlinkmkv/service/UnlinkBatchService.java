package com.scholary.unlinkmkv.service;

import com.scholary.unlinkmkv.config.UnlinkProperties;
import com.scholary.unlinkmkv.logging.StructuredLogger;
import com.scholary.unlinkmkv.segment.SegmentRegistryCache;
import com.scholary.unlinkmkv.toolchain.Toolchain;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the unlink pipeline over a set of files and directories.
 *
 * <p>Every file is processed inside its own error boundary: a failure is logged and recorded in the
 * {@link BatchReport}, and the batch moves on to the next file.
 */
@Service
public class UnlinkBatchService {

  private static final Logger LOGGER = LoggerFactory.getLogger(UnlinkBatchService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final UnlinkPipeline pipeline;
  private final Toolchain toolchain;
  private final UnlinkProperties properties;

  public UnlinkBatchService(
      UnlinkPipeline pipeline, Toolchain toolchain, UnlinkProperties properties) {
    this.pipeline = pipeline;
    this.toolchain = toolchain;
    this.properties = properties;
  }

  /**
   * Process files and directories.
   *
   * <p>Directories contribute their {@code .mkv} files (not recursively), except those whose
   * output already exists. Explicitly named files are always processed.
   *
   * @param jobId identifier used in the batch summary
   * @param paths files and directories
   * @return one result per file; unusable paths first, then files in path order
   */
  public BatchReport run(String jobId, List<Path> paths) {
    List<FileResult> results = new ArrayList<>();
    TreeSet<Path> files = new TreeSet<>();

    for (Path path : paths) {
      Path absolute = path.toAbsolutePath().normalize();
      if (Files.isDirectory(absolute)) {
        try {
          files.addAll(expand(absolute));
        } catch (IOException e) {
          structuredLogger.logFileFailed(
              absolute.toString(), e.getClass().getSimpleName(), e.getMessage());
          results.add(FileResult.failed(absolute, "Unable to list directory: " + e.getMessage()));
        }
      } else if (Files.isRegularFile(absolute)) {
        files.add(absolute);
      } else {
        LOGGER.warn("No such file or directory: {}", absolute);
        results.add(FileResult.failed(absolute, "No such file or directory"));
      }
    }

    LOGGER.info("Processing {} files", files.size());
    SegmentRegistryCache registries =
        new SegmentRegistryCache(toolchain, properties.registryCacheSize());

    for (Path file : files) {
      results.add(processFile(file, registries));
    }

    BatchReport report = new BatchReport(results);
    LOGGER.debug(registries.getStats());
    structuredLogger.logBatchFinished(
        jobId, (int) report.succeeded(), (int) report.skipped(), (int) report.failed());
    return report;
  }

  private FileResult processFile(Path file, SegmentRegistryCache registries) {
    long startTime = System.currentTimeMillis();
    StructuredLogger.setFileContext(file.getFileName().toString());
    try {
      structuredLogger.logFileStarted(file.toString());

      FileResult result;
      try {
        result = pipeline.process(file, registries);
      } catch (IOException | RuntimeException e) {
        LOGGER.debug("Failure details for {}", file, e);
        structuredLogger.logFileFailed(
            file.toString(), e.getClass().getSimpleName(), e.getMessage());
        result = FileResult.failed(file, e.getMessage());
      }

      structuredLogger.logFileFinished(
          file.toString(), result.outcome().name(), System.currentTimeMillis() - startTime);
      return result;
    } finally {
      StructuredLogger.clearFileContext();
    }
  }

  private List<Path> expand(Path directory) throws IOException {
    Path outDir = Paths.get(properties.outDir());
    try (Stream<Path> listing = Files.list(directory)) {
      return listing
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".mkv"))
          .filter(
              p -> {
                boolean done = Files.exists(outDir.resolve(p.getFileName()));
                if (done) {
                  LOGGER.info("Skipping {}, output already exists", p.getFileName());
                }
                return !done;
              })
          .toList();
    }
  }
}
