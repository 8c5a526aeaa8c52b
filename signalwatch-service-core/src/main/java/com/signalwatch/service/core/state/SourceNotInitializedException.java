package com.signalwatch.service.core.state;

/** A source was referenced before {@link StateStore#initialize(String, String)} was called for it. */
public class SourceNotInitializedException extends IllegalStateException {
    private final String sourceId;

    public SourceNotInitializedException(String sourceId) {
        super("Source " + sourceId + " state not initialized");
        this.sourceId = sourceId;
    }

    public String sourceId() {
        return sourceId;
    }
}
