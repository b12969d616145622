package com.hegel.fusion.integration;

/**
 * An evidence item that was expected for the entity but not collected. It enters the network as a
 * bare node so that the network can predict it.
 */
public record ExpectedEvidence(String id, String evidenceType) {}
