package com.hegel.fusion.integration;

import java.util.List;

/**
 * Records that disagree about the same payload attribute.
 *
 * @param severity spread between the highest and lowest confidence in the group
 */
public record EvidenceConflict(String description,
                               List<String> evidenceIds,
                               double severity,
                               List<String> resolutionSuggestions) {

    public EvidenceConflict {
        evidenceIds = List.copyOf(evidenceIds);
        resolutionSuggestions = List.copyOf(resolutionSuggestions);
    }
}
