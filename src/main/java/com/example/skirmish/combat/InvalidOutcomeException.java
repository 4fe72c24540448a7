package com.example.skirmish.combat;

/**
 * A skill outcome failed validation (unknown roll quality or non-positive output).
 */
public class InvalidOutcomeException extends CombatException {

    public InvalidOutcomeException(String message) {
        super(ErrorKind.INVALID_OUTCOME, message);
    }
}
