package com.thedigest.continuity.model;

import java.io.Serializable;

/**
 * Composite key for {@link ContinuitySnapshot}.
 */
public record ContinuitySnapshotId(
        String clientId,
        String snapshotHash,
        String depth
) implements Serializable {
}
