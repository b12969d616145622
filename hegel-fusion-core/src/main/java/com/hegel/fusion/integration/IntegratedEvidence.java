package com.hegel.fusion.integration;

import java.time.Instant;
import java.util.List;

public record IntegratedEvidence(String entityId,
                                 List<Evidence> evidenceItems,
                                 double aggregateConfidence,
                                 List<EvidenceConflict> conflicts,
                                 Instant integratedAt) {

    public IntegratedEvidence {
        evidenceItems = List.copyOf(evidenceItems);
        conflicts = List.copyOf(conflicts);
    }
}
