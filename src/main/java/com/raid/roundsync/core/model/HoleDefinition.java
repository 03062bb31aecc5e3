package com.raid.roundsync.core.model;

/**
 * One hole of a course as it appears in a snapshot.
 */
public record HoleDefinition(int holeNumber, int par) {

    public HoleDefinition {
        if (holeNumber < 1 || holeNumber > 18) {
            throw new IllegalArgumentException("holeNumber must be 1..18, got " + holeNumber);
        }
        if (par < 3 || par > 6) {
            throw new IllegalArgumentException("par must be 3..6, got " + par + " for hole " + holeNumber);
        }
    }
}
