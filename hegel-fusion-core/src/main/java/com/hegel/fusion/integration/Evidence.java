package com.hegel.fusion.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;

/**
 * Evidence record as produced by upstream collaborators (file parsers, graph store queries).
 *
 * @param confidence confidence in [0,1], with any upstream adjustments already applied
 * @param data       raw payload; numeric top-level fields become contextual factors
 * @param timestamp  when the evidence was recorded, or {@code null} for "now"
 */
public record Evidence(String id,
                       String source,
                       String evidenceType,
                       double confidence,
                       JsonNode data,
                       Instant timestamp) {

    public Evidence {
        data = data == null ? NullNode.getInstance() : data;
    }

    public Evidence(String id, String source, String evidenceType, double confidence) {
        this(id, source, evidenceType, confidence, NullNode.getInstance(), null);
    }

    public Evidence(String id, String source, String evidenceType, double confidence, JsonNode data) {
        this(id, source, evidenceType, confidence, data, null);
    }
}
