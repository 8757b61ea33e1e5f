package com.di.retailetl.validation;

import java.util.Objects;

/**
 * Per-row outcome of validation. {@code VALID} carries no reason; {@code REPAIRABLE} and
 * {@code REJECTED} always carry one of the codes in {@link RejectionReasons}.
 */
public final class ValidationVerdict {

    public enum Kind {
        VALID,
        REPAIRABLE,
        REJECTED
    }

    private static final ValidationVerdict VALID = new ValidationVerdict(Kind.VALID, null);

    private final Kind kind;
    private final String reason;

    private ValidationVerdict(Kind kind, String reason) {
        this.kind = kind;
        this.reason = reason;
    }

    public static ValidationVerdict valid() {
        return VALID;
    }

    public static ValidationVerdict repairable(String reason) {
        return new ValidationVerdict(Kind.REPAIRABLE, Objects.requireNonNull(reason, "reason"));
    }

    public static ValidationVerdict rejected(String reason) {
        return new ValidationVerdict(Kind.REJECTED, Objects.requireNonNull(reason, "reason"));
    }

    public Kind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }

    public boolean isValid() {
        return kind == Kind.VALID;
    }

    public boolean isRepairable() {
        return kind == Kind.REPAIRABLE;
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }

    public boolean is(Kind expectedKind, String expectedReason) {
        return kind == expectedKind && Objects.equals(reason, expectedReason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidationVerdict)) {
            return false;
        }
        ValidationVerdict other = (ValidationVerdict) o;
        return kind == other.kind && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, reason);
    }

    @Override
    public String toString() {
        return reason == null ? kind.name() : kind.name() + "(" + reason + ")";
    }
}
