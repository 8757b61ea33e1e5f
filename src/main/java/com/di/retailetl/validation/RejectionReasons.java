package com.di.retailetl.validation;

/**
 * Reason codes carried by {@link ValidationVerdict} and {@link com.di.retailetl.model.RejectedRow}.
 */
public final class RejectionReasons {

    public static final String MISSING_REQUIRED = "missing_required";
    public static final String TYPE_MISMATCH = "type_mismatch";
    public static final String UNCOERCIBLE = "uncoercible";
    public static final String CONSTRAINT_VIOLATION = "constraint_violation";
    public static final String INTRA_BATCH_DUPLICATE = "intra_batch_duplicate";
    public static final String REPAIR_FAILED = "repair_failed";

    private RejectionReasons() {
    }
}
