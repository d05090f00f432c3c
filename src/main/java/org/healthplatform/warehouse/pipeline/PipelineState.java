package org.healthplatform.warehouse.pipeline;

/**
 * Stages of one transform run, in execution order. {@link #FAILED} is absorbing and reachable
 * from every stage before {@link #DONE}.
 */
public enum PipelineState {
    FETCHING("Fetching"),
    DETECTING("Detecting"),
    PARSING("Parsing"),
    FILTERING("Filtering"),
    VALIDATING("Validating"),
    NORMALIZING("Normalizing"),
    LOADING("Loading"),
    DONE("Done"),
    FAILED("Failed");

    private final String label;

    PipelineState(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * The stage that follows this one on the success path.
     */
    public PipelineState next() {
        if (isTerminal()) {
            throw new IllegalStateException(label + " is terminal");
        }
        return values()[ordinal() + 1];
    }
}
