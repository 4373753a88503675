package com.openforge.filemate.date;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of {@link DateResolver#extractDate}.
 *
 * @param date       formatted date, absent only for a source that produced nothing
 * @param source     which source produced the date
 * @param confidence trust in the date, 0..1
 * @param rawMatch   the matched text or timestamp the date was derived from
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DateExtractionResult(
        String     date,
        DateSource source,
        double     confidence,
        String     rawMatch
) {

    public static DateExtractionResult absent(DateSource source) {
        return new DateExtractionResult(null, source, 0.0, null);
    }

    public boolean isPresent() {
        return date != null && !date.isBlank();
    }
}
