package io.giantt.doctor;

import io.giantt.model.RelationType;

import java.util.Locale;

/**
 * A detected graph inconsistency. {@code relatedId} is the missing target for a dangling
 * reference, or the item lacking the reciprocal entry for an incomplete chain.
 */
public record Issue(
        IssueType type,
        String itemId,
        RelationType relationType,
        String relatedId,
        String message
) {
    public static Issue danglingReference(String itemId, RelationType relationType, String missingId) {
        return new Issue(IssueType.DANGLING_REFERENCE, itemId, relationType, missingId,
                "'" + itemId + "' " + relationType.name().toLowerCase(Locale.ROOT) + " missing item '" + missingId + "'");
    }

    public static Issue incompleteChain(String itemId, RelationType relationType, String relatedId) {
        return new Issue(IssueType.INCOMPLETE_CHAIN, itemId, relationType, relatedId,
                "'" + itemId + "' " + relationType.name().toLowerCase(Locale.ROOT) + " '" + relatedId
                        + "' but '" + relatedId + "' has no " + relationType.mirror().name().toLowerCase(Locale.ROOT)
                        + " entry for '" + itemId + "'");
    }
}
