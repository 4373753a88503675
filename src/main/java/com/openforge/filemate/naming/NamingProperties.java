package com.openforge.filemate.naming;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * File naming settings.
 *
 * application.yml:
 *
 * filemate:
 *   naming:
 *     max-length: 200
 *     version-format: SIMPLE      # SIMPLE (v1.0 → v1.1) | SEMANTIC (v1.0.0 → v1.0.1)
 *     initial-version: v1.0
 *     fallback-subject: 未分类文档
 */
@Validated
@ConfigurationProperties(prefix = "filemate.naming")
public record NamingProperties(
        @DefaultValue("200") @Min(8) int maxLength,
        @DefaultValue("SIMPLE") @NotNull VersionFormat versionFormat,
        @DefaultValue("v1.0") @NotBlank String initialVersion,
        @DefaultValue("未分类文档") @NotBlank String fallbackSubject
) {

    public static NamingProperties defaults() {
        return new NamingProperties(200, VersionFormat.SIMPLE, "v1.0", "未分类文档");
    }

    /** The configured initial version, written in the configured format. */
    public VersionTag initialTag() {
        return VersionTag.parse(initialVersion).in(versionFormat);
    }
}
