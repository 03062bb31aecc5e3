package com.raid.roundsync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable course + tee definition, addressed by the SHA-256 of its canonical JSON form.
 *
 * <p>Two devices given the same course name, tee set and holes compute the same
 * {@link #contentHash()}. The hash is the primary key locally and is embedded in every
 * round initiation event so recipients can recompute and compare it.</p>
 *
 * <p>{@link #holes()} is always ordered by hole number.</p>
 */
public record CourseSnapshot(
        String contentHash,
        String courseName,
        String teeSetName,
        List<HoleDefinition> holes
) {

    public CourseSnapshot {
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(courseName, "courseName");
        Objects.requireNonNull(teeSetName, "teeSetName");
        holes = List.copyOf(holes);
    }

    public int holeCount() {
        return holes.size();
    }

    public boolean hasHole(int holeNumber) {
        return holes.stream().anyMatch(h -> h.holeNumber() == holeNumber);
    }

    public int parFor(int holeNumber) {
        return holes.stream()
                .filter(h -> h.holeNumber() == holeNumber)
                .mapToInt(HoleDefinition::par)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Hole " + holeNumber + " is not part of course " + contentHash));
    }

    public int totalPar() {
        return holes.stream().mapToInt(HoleDefinition::par).sum();
    }
}
