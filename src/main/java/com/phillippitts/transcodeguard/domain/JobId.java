package com.phillippitts.transcodeguard.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque job identifier.
 */
public record JobId(String value) {

    public JobId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("JobId must not be blank");
        }
    }

    public static JobId random() {
        return new JobId(UUID.randomUUID().toString());
    }

    public static JobId of(String value) {
        return new JobId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
