package com.example.skirmish.combat;

public class NoActionsToResolveException extends CombatException {

    public NoActionsToResolveException(long roundId) {
        super(ErrorKind.NO_ACTIONS_TO_RESOLVE, "No actions to resolve in combat round " + roundId, roundId, null);
    }
}
