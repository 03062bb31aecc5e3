package com.raid.roundsync.core.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers over the {@code [[name, value, ...], ...]} tag structure of an event.
 */
public final class Tags {

    private Tags() {
    }

    public static List<String> tag(String... parts) {
        return List.of(parts);
    }

    public static Optional<String> first(List<List<String>> tags, String name) {
        return tags.stream()
                .filter(t -> t.size() >= 2 && name.equals(t.get(0)))
                .map(t -> t.get(1))
                .findFirst();
    }

    public static List<String> values(List<List<String>> tags, String name) {
        List<String> out = new ArrayList<>();
        for (List<String> t : tags) {
            if (t.size() >= 2 && name.equals(t.get(0))) {
                out.add(t.get(1));
            }
        }
        return out;
    }

    public static List<List<String>> all(List<List<String>> tags, String name) {
        List<List<String>> out = new ArrayList<>();
        for (List<String> t : tags) {
            if (!t.isEmpty() && name.equals(t.get(0))) {
                out.add(t);
            }
        }
        return out;
    }

    public static List<List<String>> copyOf(List<List<String>> tags) {
        List<List<String>> out = new ArrayList<>(tags.size());
        for (List<String> t : tags) {
            out.add(List.copyOf(t));
        }
        return List.copyOf(out);
    }
}
