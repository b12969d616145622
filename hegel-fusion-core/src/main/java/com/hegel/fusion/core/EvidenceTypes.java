package com.hegel.fusion.core;

/**
 * Evidence type tags and the per-type calibration constants that depend on them.
 */
public final class EvidenceTypes {
    private EvidenceTypes() {}

    public static final String GENOMICS = "genomics";
    public static final String MASS_SPEC = "mass_spec";
    public static final String LITERATURE = "literature";
    public static final String PROTEOMICS = "proteomics";
    public static final String METABOLOMICS = "metabolomics";
    public static final String PATHWAY = "pathway";
    public static final String REACTOME = "reactome";
    public static final String OTHER = "other";

    // relative half-widths of the uncertainty interval around a raw value
    public static final double MASS_SPEC_UNCERTAINTY = 0.05;
    public static final double GENOMICS_UNCERTAINTY = 0.10;
    public static final double LITERATURE_UNCERTAINTY = 0.15;
    public static final double DEFAULT_UNCERTAINTY = 0.10;

    public static double uncertaintyHalfWidth(String evidenceType) {
        if (evidenceType == null) return DEFAULT_UNCERTAINTY;
        return switch (evidenceType) {
            case MASS_SPEC -> MASS_SPEC_UNCERTAINTY;
            case GENOMICS -> GENOMICS_UNCERTAINTY;
            case LITERATURE -> LITERATURE_UNCERTAINTY;
            default -> DEFAULT_UNCERTAINTY;
        };
    }
}
