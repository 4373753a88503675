package com.openforge.filemate.date;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Date extraction settings.
 *
 * application.yml:
 *
 * filemate:
 *   dates:
 *     priority: [CONTENT, CREATION, MODIFICATION, CURRENT]
 *     format: "%Y%m%d"          # strftime notation, e.g. "%Y-%m-%d", "%Y年%m月%d日"
 *     content-scan-limit: 1000  # chars scanned when no keyword line carries a date
 */
@Validated
@ConfigurationProperties(prefix = "filemate.dates")
public record DateProperties(
        @DefaultValue({"CONTENT", "CREATION", "MODIFICATION", "CURRENT"})
        @NotEmpty List<DateSource> priority,

        @DefaultValue("%Y%m%d") @NotBlank String format,

        @DefaultValue("1000") @Min(1) int contentScanLimit
) {

    public static DateProperties defaults() {
        return new DateProperties(
                List.of(DateSource.CONTENT, DateSource.CREATION, DateSource.MODIFICATION, DateSource.CURRENT),
                "%Y%m%d",
                1000);
    }
}
