package com.scholary.unlinkmkv.toolchain;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Locations of the MKVToolNix binaries.
 *
 * <p>Plain names are looked up on the {@code PATH}. {@code locale} is passed as {@code
 * --ui-language} so tool output does not depend on the host's language.
 */
@ConfigurationProperties(prefix = "mkvtoolnix")
@Validated
public record MkvToolnixProperties(
    @NotBlank String mkvmerge,
    @NotBlank String mkvextract,
    @NotBlank String mkvpropedit,
    @NotBlank String locale) {}
