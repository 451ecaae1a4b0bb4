package uk.gegc.skillgrader.features.reference.domain.model;

import java.util.UUID;

/**
 * Result of proposing a reference. Rejections (low score, duplicate, storage failure) carry a reason.
 */
public record ReferenceInsertOutcome(boolean added, UUID id, String reason) {

    public static ReferenceInsertOutcome added(UUID id) {
        return new ReferenceInsertOutcome(true, id, null);
    }

    public static ReferenceInsertOutcome rejected(String reason) {
        return new ReferenceInsertOutcome(false, null, reason);
    }
}
