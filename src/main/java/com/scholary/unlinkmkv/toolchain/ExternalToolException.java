package com.scholary.unlinkmkv.toolchain;

import com.scholary.unlinkmkv.UnlinkException;
import java.util.List;

/**
 * Exception thrown when an external MKVToolNix binary fails.
 *
 * <p>Carries the full command line and the captured output so the failure can be logged and
 * reported without re-running the tool.
 */
public class ExternalToolException extends UnlinkException {

  private final List<String> command;
  private final int exitCode;
  private final String output;

  public ExternalToolException(List<String> command, int exitCode, String output) {
    super(
        String.format(
            "Command failed with exit code %d: %s", exitCode, String.join(" ", command)));
    this.command = List.copyOf(command);
    this.exitCode = exitCode;
    this.output = output;
  }

  public ExternalToolException(List<String> command, String message, Throwable cause) {
    super(message + ": " + String.join(" ", command), cause);
    this.command = List.copyOf(command);
    this.exitCode = -1;
    this.output = "";
  }

  public List<String> getCommand() {
    return command;
  }

  public int getExitCode() {
    return exitCode;
  }

  public String getOutput() {
    return output;
  }
}
