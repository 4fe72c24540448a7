package com.example.skirmish.combat;

public class InvalidEventTypeException extends CombatException {

    public InvalidEventTypeException(String type) {
        super(ErrorKind.INVALID_EVENT_TYPE,
                "Invalid event type '" + type + "'. Must be one of: lore, duel, quest");
    }
}
