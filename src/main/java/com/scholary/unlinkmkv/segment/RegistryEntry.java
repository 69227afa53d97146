package com.scholary.unlinkmkv.segment;

import com.scholary.unlinkmkv.timecode.Timecode;
import java.nio.file.Path;

/**
 * A file that can satisfy segment references.
 *
 * @param id normalized (lowercase hex) segment UID
 * @param file absolute path of the providing file
 * @param duration duration of the whole file
 */
public record RegistryEntry(String id, Path file, Timecode duration) {}
