package com.enterprise.morpher.migration.domain;

import java.util.Objects;

/**
 * A column value that is either present or explicitly absent (SQL NULL).
 * Absent is never coerced to zero or an empty string.
 */
public sealed interface FieldValue permits FieldValue.Present, FieldValue.Absent {

    static FieldValue of(Object value) {
        if (value instanceof FieldValue fv) {
            return fv;
        }
        return value == null ? Absent.INSTANCE : new Present(value);
    }

    static FieldValue absent() {
        return Absent.INSTANCE;
    }

    boolean isAbsent();

    /** The raw value, {@code null} when absent. */
    Object orNull();

    record Present(Object value) implements FieldValue {
        public Present {
            Objects.requireNonNull(value, "use FieldValue.absent() for NULL");
        }

        @Override
        public boolean isAbsent() {
            return false;
        }

        @Override
        public Object orNull() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    enum Absent implements FieldValue {
        INSTANCE;

        @Override
        public boolean isAbsent() {
            return true;
        }

        @Override
        public Object orNull() {
            return null;
        }

        @Override
        public String toString() {
            return "NULL";
        }
    }
}
