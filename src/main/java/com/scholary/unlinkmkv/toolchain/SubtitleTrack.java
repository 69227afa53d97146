package com.scholary.unlinkmkv.toolchain;

import java.nio.file.Path;

/**
 * A subtitle track extracted to a file.
 *
 * @param trackId mkvmerge track id in the source file
 * @param path extracted script
 * @param language track language, or {@code null}
 * @param name track name, or {@code null}
 */
public record SubtitleTrack(int trackId, Path path, String language, String name) {}
