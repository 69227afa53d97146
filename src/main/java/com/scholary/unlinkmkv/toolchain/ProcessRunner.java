package com.scholary.unlinkmkv.toolchain;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs external commands and captures their combined output.
 *
 * <p>Follows the MKVToolNix exit code convention: 0 is success, 1 is success with warnings and
 * anything higher is an error.
 */
@Component
public class ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);

  static final int EXIT_WARNINGS = 1;

  /**
   * Run a command to completion.
   *
   * @param command program and arguments
   * @return stdout and stderr, interleaved
   * @throws ExternalToolException if the command cannot be started, is interrupted or exits with
   *     an error
   */
  public String run(List<String> command) {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);

    try {
      Process process = pb.start();
      // drain before waiting, mkvmerge -J output can exceed the pipe buffer
      String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
      int exitCode = process.waitFor();

      if (exitCode == EXIT_WARNINGS) {
        LOGGER.warn("{} finished with warnings: {}", command.get(0), output.trim());
      } else if (exitCode != 0) {
        LOGGER.error(
            "{} failed with exit code {}: {}", command.get(0), exitCode, output.trim());
        throw new ExternalToolException(command, exitCode, output);
      }
      return output;

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExternalToolException(command, "Interrupted while running", e);
    } catch (IOException e) {
      LOGGER.error("Unable to run {}", command.get(0), e);
      throw new ExternalToolException(command, "Unable to run", e);
    }
  }
}
