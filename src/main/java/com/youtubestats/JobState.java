package com.youtubestats;

/**
 * Lifecycle of one pipeline run. Transitions only move forward; there are no retries.
 */
public enum JobState {
    INITIALIZED,
    READING,
    MAPPING,
    WRITING,
    COMMITTED,
    FAILED;
    
    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED;
    }
    
    boolean canMoveTo(JobState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
