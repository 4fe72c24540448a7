package com.example.skirmish.combat;

public class LocationRequiredException extends CombatException {

    public LocationRequiredException() {
        super(ErrorKind.LOCATION_REQUIRED, "A location is required to create a combat round");
    }
}
