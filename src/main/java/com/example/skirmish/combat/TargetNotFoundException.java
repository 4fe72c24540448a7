package com.example.skirmish.combat;

import java.util.Collections;
import java.util.List;

/**
 * A skill's target could not be resolved. Carries the targets that would have been valid.
 */
public class TargetNotFoundException extends CombatException {
    private final List<String> availableTargets;

    public TargetNotFoundException(String reason, Integer characterId, List<String> availableTargets) {
        super(ErrorKind.TARGET_NOT_FOUND, buildMessage(reason, availableTargets), null, characterId);
        this.availableTargets = availableTargets != null ? List.copyOf(availableTargets) : Collections.emptyList();
    }

    public List<String> getAvailableTargets() {
        return availableTargets;
    }

    private static String buildMessage(String reason, List<String> available) {
        if (available == null || available.isEmpty()) {
            return reason + ". No other active characters are available.";
        }
        return reason + ". Available characters: " + String.join(", ", available);
    }
}
