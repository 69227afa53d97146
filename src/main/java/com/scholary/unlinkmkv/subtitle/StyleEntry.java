package com.scholary.unlinkmkv.subtitle;

/**
 * A style definition after disambiguation.
 *
 * @param name the new, suffixed style name
 * @param definitionLine the complete rewritten {@code Style:} line
 * @param sourceTag fingerprint of the file the style came from
 */
public record StyleEntry(String name, String definitionLine, String sourceTag) {}
