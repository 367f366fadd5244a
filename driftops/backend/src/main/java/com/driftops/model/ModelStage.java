package com.driftops.model;

public enum ModelStage {
    CANDIDATE,
    PRODUCTION,
    ARCHIVED;

    /**
     * ARCHIVED versions only return to PRODUCTION through an explicit rollback; nothing
     * ever returns to CANDIDATE.
     */
    public boolean canTransitionTo(ModelStage target, boolean rollback) {
        return switch (this) {
            case CANDIDATE -> target == PRODUCTION || target == ARCHIVED;
            case PRODUCTION -> target == ARCHIVED;
            case ARCHIVED -> rollback && target == PRODUCTION;
        };
    }
}
