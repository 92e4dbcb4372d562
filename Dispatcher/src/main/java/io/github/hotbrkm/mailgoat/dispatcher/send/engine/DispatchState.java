package io.github.hotbrkm.mailgoat.dispatcher.send.engine;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the dispatch loop for one batch.
 * <p>
 * IDLE → RENDERING → (SENDING →) RECORDED → RENDERING ... → SEALED. A render failure goes straight from RENDERING
 * to RECORDED; an empty input seals from IDLE.
 */
public enum DispatchState {
    IDLE,
    RENDERING,
    SENDING,
    RECORDED,
    SEALED;

    private Set<DispatchState> allowedNext() {
        return switch (this) {
            case IDLE -> EnumSet.of(RENDERING, SEALED);
            case RENDERING -> EnumSet.of(SENDING, RECORDED);
            case SENDING -> EnumSet.of(RECORDED);
            case RECORDED -> EnumSet.of(RENDERING, SEALED);
            case SEALED -> EnumSet.noneOf(DispatchState.class);
        };
    }

    public boolean canTransitionTo(DispatchState next) {
        return allowedNext().contains(next);
    }

    /**
     * @return {@code next}
     * @throws IllegalStateException if the transition is not allowed
     */
    public DispatchState transitionTo(DispatchState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("illegal dispatch transition " + this + " -> " + next);
        }
        return next;
    }
}
