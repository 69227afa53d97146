package com.scholary.unlinkmkv.toolchain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

@DisabledOnOs(OS.WINDOWS)
class ProcessRunnerTest {

  private final ProcessRunner processRunner = new ProcessRunner();

  @Test
  void run_shouldReturnCombinedOutput() {
    String output = processRunner.run(List.of("sh", "-c", "echo out; echo err 1>&2"));

    assertThat(output).contains("out").contains("err");
  }

  @Test
  void run_shouldAcceptWarningExitCode() {
    String output = processRunner.run(List.of("sh", "-c", "echo careful; exit 1"));

    assertThat(output).contains("careful");
  }

  @Test
  void run_shouldThrowOnErrorExitCode() {
    assertThatThrownBy(() -> processRunner.run(List.of("sh", "-c", "echo broken; exit 2")))
        .isInstanceOfSatisfying(
            ExternalToolException.class,
            e -> {
              assertThat(e.getExitCode()).isEqualTo(2);
              assertThat(e.getOutput()).contains("broken");
              assertThat(e.getCommand()).startsWith("sh");
            });
  }

  @Test
  void run_shouldThrowWhenProgramIsMissing() {
    assertThatThrownBy(() -> processRunner.run(List.of("no-such-program-unlink-mkv")))
        .isInstanceOf(ExternalToolException.class)
        .hasMessageContaining("Unable to run");
  }
}
