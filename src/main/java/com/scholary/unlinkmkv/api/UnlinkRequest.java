package com.scholary.unlinkmkv.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request to unlink files.
 *
 * @param paths files or directories on the server; directories contribute their {@code .mkv} files
 */
public record UnlinkRequest(@NotEmpty List<@NotBlank String> paths) {}
