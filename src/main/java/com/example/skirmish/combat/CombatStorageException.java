package com.example.skirmish.combat;

/**
 * Wraps a storage failure. The message names the operation, the cause keeps the driver detail.
 */
public class CombatStorageException extends CombatException {

    public CombatStorageException(String operation, Throwable cause) {
        super(ErrorKind.STORAGE, "Failed to " + operation, null, null, cause);
    }

    public CombatStorageException(String operation, Long roundId, Throwable cause) {
        super(ErrorKind.STORAGE, "Failed to " + operation, roundId, null, cause);
    }
}
