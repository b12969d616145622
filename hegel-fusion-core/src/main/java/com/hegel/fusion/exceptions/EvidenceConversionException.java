package com.hegel.fusion.exceptions;

/**
 * Thrown when a single evidence record cannot be turned into fuzzy evidence.
 * <p>
 * The integrator catches this per record and reports it in the integration errors of the
 * result; it never aborts a batch.
 * </p>
 */
public class EvidenceConversionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String evidenceId;

    public EvidenceConversionException(String evidenceId, String message) {
        super(message);
        this.evidenceId = evidenceId;
    }

    public EvidenceConversionException(String evidenceId, String message, Throwable cause) {
        super(message, cause);
        this.evidenceId = evidenceId;
    }

    public String getEvidenceId() {
        return evidenceId;
    }
}
