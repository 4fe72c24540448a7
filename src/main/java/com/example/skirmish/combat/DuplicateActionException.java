package com.example.skirmish.combat;

public class DuplicateActionException extends CombatException {

    public DuplicateActionException(long roundId, int characterId) {
        super(ErrorKind.DUPLICATE_ACTION,
                "Character " + characterId + " has already submitted an action for round " + roundId,
                roundId, characterId);
    }
}
