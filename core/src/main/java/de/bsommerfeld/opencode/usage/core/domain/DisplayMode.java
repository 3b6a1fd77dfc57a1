package de.bsommerfeld.opencode.usage.core.domain;

/**
 * Time window a usage figure covers. Windows are evaluated against the
 * modification time of the part files in the reader's time zone.
 */
public enum DisplayMode {

    /** Files modified since local midnight. */
    TODAY,

    /** Files modified since the first day of the current month. */
    MONTH,

    /** Files modified during the previous calendar month. */
    LAST_MONTH,

    /** Every file in the storage root. The only cached window. */
    ALL_TIME
}
