package com.kakomon.harvest;

/**
 * Session harvester states. {@link #CONVERGED}, {@link #CAPPED} and {@link #FAILED} are terminal.
 */
public enum HarvestState {
    IDLE,
    FETCHING,
    EXTRACTING,
    CONTINUING,
    CONVERGED,
    CAPPED,
    FAILED;

    public boolean isTerminal() {
        return this == CONVERGED || this == CAPPED || this == FAILED;
    }
}
