package com.phillippitts.transcodeguard.domain;

import java.util.Objects;

/**
 * Why a job ended in {@link JobState#FAILED}.
 *
 * @param category broad failure class
 * @param code machine-readable code (validation reason, engine code, timeout operation)
 * @param message human-readable explanation for callers
 */
public record FailureReason(Category category, String code, String message) {

    public enum Category { VALIDATION, ENGINE, TIMEOUT }

    public FailureReason {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
        if (code == null) {
            code = category.name();
        }
    }

    @Override
    public String toString() {
        return message;
    }
}
