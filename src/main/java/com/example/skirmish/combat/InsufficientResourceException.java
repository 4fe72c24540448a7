package com.example.skirmish.combat;

/**
 * The character cannot pay for a skill: not enough aether, or a required stat is too low.
 */
public class InsufficientResourceException extends CombatException {
    private final String resource;
    private final int required;
    private final int available;

    public InsufficientResourceException(int characterId, String skillName, String resource,
                                         int required, int available) {
        super(ErrorKind.INSUFFICIENT_RESOURCE,
                "Insufficient " + resource + " to use " + skillName + " (requires " + required
                        + ", has " + available + ")", null, characterId);
        this.resource = resource;
        this.required = required;
        this.available = available;
    }

    public String getResource() { return resource; }
    public int getRequired() { return required; }
    public int getAvailable() { return available; }
}
