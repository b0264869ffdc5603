package com.eainde.xrf.parse;

import com.eainde.xrf.model.Reading;

/**
 * Result of classifying one data row: exactly one of the nested variants.
 */
public interface RowOutcome {

    /** A valid measurement. */
    record Accepted(Reading reading) implements RowOutcome {}

    /** A device self-check against a reference standard. Counted, never reported. */
    record CalibrationSkip(int rowNumber) implements RowOutcome {}

    /** Not a usable shot; reported with the reason so the source file can be fixed. */
    record JunkSkip(int rowNumber, JunkReason reason) implements RowOutcome {}

    /** The row could not be processed at all. */
    record RowError(int rowNumber, String message) implements RowOutcome {}
}
