package com.raid.roundsync.core.relay;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.subject.RelaySubject;

/**
 * Selection of events of one kind. Every non-null criterion must match.
 *
 * @param authors empty means any author
 * @param ref     the reference token (d, e or p tag depending on kind); null means any
 * @param eventId a single event id; null means any
 * @param since   lower bound on {@code created_at}; null means unbounded
 * @param limit   maximum number of events per relay
 */
public record RelayFilter(
        int kind,
        Set<String> authors,
        String ref,
        String eventId,
        Instant since,
        int limit
) {

    public static final int DEFAULT_LIMIT = 500;

    public RelayFilter {
        authors = authors == null ? Set.of() : Set.copyOf(authors);
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static RelayFilter kind(int kind) {
        return new RelayFilter(kind, Set.of(), null, null, null, DEFAULT_LIMIT);
    }

    public RelayFilter authors(Collection<String> keys) {
        return new RelayFilter(kind, new LinkedHashSet<>(keys), ref, eventId, since, limit);
    }

    public RelayFilter author(String key) {
        return authors(List.of(key));
    }

    public RelayFilter ref(String value) {
        return new RelayFilter(kind, authors, value, eventId, since, limit);
    }

    public RelayFilter id(String value) {
        return new RelayFilter(kind, authors, ref, value, since, limit);
    }

    public RelayFilter since(Instant value) {
        return new RelayFilter(kind, authors, ref, eventId, value, limit);
    }

    public RelayFilter limit(int value) {
        return new RelayFilter(kind, authors, ref, eventId, since, value);
    }

    /** One JetStream filter subject per author (or a single wildcard subject). */
    public List<String> subjects() {
        List<String> out = new ArrayList<>();
        if (authors.isEmpty()) {
            out.add(RelaySubject.filter(kind, null, ref, eventId));
        } else {
            for (String author : authors) {
                out.add(RelaySubject.filter(kind, author, ref, eventId));
            }
        }
        return out;
    }

    /** Client-side check; relays are not trusted to have applied the subject filter. */
    public boolean matches(RelayEvent event) {
        if (event.kind() != kind) {
            return false;
        }
        if (!authors.isEmpty() && !authors.contains(event.pubkey())) {
            return false;
        }
        if (eventId != null && !eventId.equals(event.id())) {
            return false;
        }
        if (since != null && event.createdAt() < since.getEpochSecond()) {
            return false;
        }
        return ref == null || RelaySubject.refToken(ref).equals(RelaySubject.of(event).ref());
    }
}
