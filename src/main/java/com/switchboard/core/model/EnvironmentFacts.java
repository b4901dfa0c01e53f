package com.switchboard.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * What verifiers know about the world the action would run in.
 *
 * @param existingPaths     paths known to exist, empty when unknown
 * @param availableCommands executables known to be installed, empty when unknown
 * @param observedEffects   paths touched by a simulated run, empty when nothing was simulated
 * @param generatedText     output produced by a simulated run, may be null
 */
public record EnvironmentFacts(
        Set<String> existingPaths,
        Set<String> availableCommands,
        Set<String> observedEffects,
        String generatedText
) implements Serializable {

    public EnvironmentFacts {
        existingPaths = existingPaths == null ? Set.of() : Set.copyOf(existingPaths);
        availableCommands = availableCommands == null ? Set.of() : Set.copyOf(availableCommands);
        observedEffects = observedEffects == null ? Set.of() : Set.copyOf(observedEffects);
    }

    public static EnvironmentFacts none() {
        return new EnvironmentFacts(Set.of(), Set.of(), Set.of(), null);
    }

    public boolean simulated() {
        return !observedEffects.isEmpty() || generatedText != null;
    }
}
