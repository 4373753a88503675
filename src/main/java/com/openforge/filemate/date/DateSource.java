package com.openforge.filemate.date;

/**
 * Where an extracted date came from.
 *
 * CONTENT      : a date written inside the document text
 * CREATION     : file creation timestamp (0.7)
 * MODIFICATION : file modification timestamp (0.6)
 * CURRENT      : the clock, as a regular configured source (0.5)
 * FALLBACK     : the clock, because no configured source produced anything (0.1)
 */
public enum DateSource {
    CONTENT,
    CREATION,
    MODIFICATION,
    CURRENT,
    FALLBACK
}
