package com.scholary.unlinkmkv.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Scratch directories for processing one file.
 *
 * <p>Layout: {@code <tmp>/<uuid>/{parts,subtitles,attach,encodes}}.
 */
public final class Workspace {

  private final Path root;

  private Workspace(Path root) {
    this.root = root;
  }

  public static Workspace create(Path tmpDir) throws IOException {
    Workspace workspace = new Workspace(tmpDir.resolve(UUID.randomUUID().toString()));
    Files.createDirectories(workspace.parts());
    Files.createDirectories(workspace.subtitles());
    Files.createDirectories(workspace.attachments());
    Files.createDirectories(workspace.encodes());
    return workspace;
  }

  public Path root() {
    return root;
  }

  public Path parts() {
    return root.resolve("parts");
  }

  public Path subtitles() {
    return root.resolve("subtitles");
  }

  public Path attachments() {
    return root.resolve("attach");
  }

  public Path encodes() {
    return root.resolve("encodes");
  }

  /** Delete the workspace and everything in it. */
  public void delete() throws IOException {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> walk = Files.walk(root)) {
      walk.sorted(Comparator.reverseOrder())
          .forEach(
              path -> {
                try {
                  Files.deleteIfExists(path);
                } catch (IOException e) {
                  throw new UncheckedIOException(e);
                }
              });
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }
}
