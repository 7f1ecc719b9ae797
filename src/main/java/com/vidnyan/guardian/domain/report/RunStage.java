package com.vidnyan.guardian.domain.report;

/**
 * Pipeline stages of one run, in execution order.
 */
public enum RunStage {
    DETECTING,
    SCHEDULING,
    RUNNING,
    NORMALIZING,
    AGGREGATING,
    REPORTING,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }

    /**
     * The single stage that may follow this one on the normal path.
     */
    RunStage next() {
        return switch (this) {
            case DETECTING -> SCHEDULING;
            case SCHEDULING -> RUNNING;
            case RUNNING -> NORMALIZING;
            case NORMALIZING -> AGGREGATING;
            case AGGREGATING -> REPORTING;
            case REPORTING -> DONE;
            case DONE, ABORTED -> null;
        };
    }
}
