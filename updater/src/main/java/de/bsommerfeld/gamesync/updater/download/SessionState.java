package de.bsommerfeld.gamesync.updater.download;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a download session. A session never returns to
 * {@link #PENDING}, and the three end states are final.
 */
public enum SessionState {

    PENDING,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

    public boolean canTransitionTo(SessionState next) {
        return successors().contains(next);
    }

    private Set<SessionState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, CANCELLED, FAILED);
            case RUNNING -> EnumSet.of(COMPLETED, CANCELLED, FAILED);
            case COMPLETED, CANCELLED, FAILED -> EnumSet.noneOf(SessionState.class);
        };
    }
}
