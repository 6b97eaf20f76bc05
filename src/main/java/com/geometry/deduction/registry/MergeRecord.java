package com.geometry.deduction.registry;

import com.geometry.deduction.core.model.ObjectKind;

import java.util.Objects;

/**
 * Immutable record of one registry merge: {@code oldKey} was retired in favour of
 * {@code survivorKey}.
 *
 * @param sequence position of the merge in the session, starting at 1
 */
public record MergeRecord(
        long sequence,
        ObjectKind kind,
        String oldKey,
        String survivorKey,
        MergeReason reason
) {
    public MergeRecord {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(oldKey, "oldKey is required");
        Objects.requireNonNull(survivorKey, "survivorKey is required");
        Objects.requireNonNull(reason, "reason is required");
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive");
        }
    }
}
