package ai.pipestream.regulatory.arbiter;

import ai.pipestream.regulatory.entity.ResolutionPolicy;

import java.util.UUID;

/**
 * Outcome of the automated policy. {@code winner} is null when the pair is
 * escalated to a human.
 */
public record Resolution(UUID winner, ResolutionPolicy policy, String escalationReason) {

    public boolean escalated() {
        return winner == null;
    }
}
