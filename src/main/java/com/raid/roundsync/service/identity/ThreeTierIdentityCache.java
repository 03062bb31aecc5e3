package com.raid.roundsync.service.identity;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raid.roundsync.core.event.EventKind;
import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.model.CachedList;
import com.raid.roundsync.core.model.Profile;
import com.raid.roundsync.core.model.SocialListKind;
import com.raid.roundsync.core.relay.RelayClient;
import com.raid.roundsync.core.relay.RelayFilter;
import com.raid.roundsync.r2dbc.store.ProfileCacheStore;
import com.raid.roundsync.r2dbc.store.SocialListCacheStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Profiles and key-owned lists, resolved memory first, then the local database, then relays.
 *
 * <h2>Merge rules</h2>
 * <ul>
 *   <li>Profiles merge field by field: a relay result missing a field never blanks a value
 *       already cached.</li>
 *   <li>Lists (follows, favorites, inbox relays) are replaced only by a fetch that is non-empty,
 *       not older and actually different. An empty or failed fetch keeps the cached list.</li>
 * </ul>
 *
 * <h2>Failure behavior</h2>
 * Relay problems degrade to the cached value and are logged. Local write failures propagate.
 */
@Service
public class ThreeTierIdentityCache {

    private static final Logger log = LoggerFactory.getLogger(ThreeTierIdentityCache.class);

    private final ProfileCacheStore profileStore;
    private final SocialListCacheStore listStore;
    private final RelayClient relays;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final Map<String, Profile> profiles = new ConcurrentHashMap<>();
    private final Map<ListKey, CachedList> lists = new ConcurrentHashMap<>();

    public ThreeTierIdentityCache(ProfileCacheStore profileStore, SocialListCacheStore listStore, RelayClient relays,
            ObjectMapper mapper, Clock clock) {
        this.profileStore = profileStore;
        this.listStore = listStore;
        this.relays = relays;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Memory and database only; no network. Keys with nothing cached map to an empty profile.
     */
    public Mono<Map<String, Profile>> cached(Collection<String> keys) {
        return Flux.fromIterable(new LinkedHashSet<>(keys))
                .concatMap(this::cachedProfile)
                .collectMap(Profile::publicKeyHex, p -> p, LinkedHashMap::new);
    }

    /**
     * Cached profiles merged with whatever relays return now. Relay failure yields the cached
     * result.
     */
    public Mono<Map<String, Profile>> resolve(Collection<String> keys) {
        Set<String> distinct = new LinkedHashSet<>(keys);
        if (distinct.isEmpty()) {
            return Mono.just(Map.of());
        }
        return cached(distinct).flatMap(current -> fetchProfiles(distinct)
                .concatMap(fetched -> mergeAndStore(current.get(fetched.publicKeyHex()), fetched))
                .then(Mono.fromCallable(() -> {
                    Map<String, Profile> out = new LinkedHashMap<>();
                    for (String key : distinct) {
                        out.put(key, profiles.getOrDefault(key, current.get(key)));
                    }
                    return out;
                })));
    }

    public Mono<Profile> profile(String key) {
        return resolve(List.of(key)).map(m -> m.get(key));
    }

    /**
     * Cached list refreshed from relays under the replacement rule. An owner with nothing known
     * gets an empty list.
     */
    public Mono<CachedList> list(SocialListKind kind, String owner) {
        return cachedList(kind, owner)
                .flatMap(current -> fetchList(kind, owner)
                        .flatMap(fetched -> replaceIfFresher(current, fetched))
                        .defaultIfEmpty(current));
    }

    public Mono<CachedList> cachedList(SocialListKind kind, String owner) {
        ListKey key = new ListKey(kind, owner);
        CachedList hit = lists.get(key);
        if (hit != null) {
            return Mono.just(hit);
        }
        return listStore.find(kind, owner)
                .doOnNext(l -> lists.put(key, l))
                .defaultIfEmpty(new CachedList(kind, owner, List.of(), Instant.EPOCH));
    }

    /** Inbox relays of {@code owner}; empty when none are known. */
    public Mono<List<String>> inboxRelays(String owner) {
        return list(SocialListKind.INBOX_RELAYS, owner).map(CachedList::members);
    }

    private Mono<Profile> cachedProfile(String key) {
        Profile hit = profiles.get(key);
        if (hit != null) {
            return Mono.just(hit);
        }
        return profileStore.find(key)
                .doOnNext(p -> profiles.put(key, p))
                .defaultIfEmpty(Profile.empty(key));
    }

    private Mono<Profile> mergeAndStore(Profile current, Profile fetched) {
        Profile merged = fetched.mergedWith(current);
        if (merged.equals(current)) {
            return Mono.just(current);
        }
        return profileStore.save(merged, clock.instant()).doOnNext(p -> profiles.put(p.publicKeyHex(), p));
    }

    Mono<CachedList> replaceIfFresher(CachedList current, CachedList fetched) {
        boolean replace = current.isEmpty() ? !fetched.isEmpty() : current.isReplaceableBy(fetched);
        if (!replace) {
            if (fetched.isEmpty() && !current.isEmpty()) {
                log.debug("Ignoring empty {} for {}; keeping {} cached entries", fetched.kind(),
                        fetched.ownerPublicKeyHex(), current.members().size());
            }
            return Mono.just(current);
        }
        return listStore.save(fetched, clock.instant())
                .doOnNext(l -> lists.put(new ListKey(l.kind(), l.ownerPublicKeyHex()), l));
    }

    private Flux<Profile> fetchProfiles(Set<String> keys) {
        return relays.query(RelayFilter.kind(EventKind.PROFILE).authors(keys))
                .groupBy(RelayEvent::pubkey)
                .flatMap(byAuthor -> byAuthor.reduce(ThreeTierIdentityCache::newer))
                .concatMap(e -> Mono.justOrEmpty(parseProfile(e)))
                .onErrorResume(err -> {
                    log.warn("Profile fetch for {} key(s) failed: {}", keys.size(), err.toString());
                    return Flux.empty();
                });
    }

    private Mono<CachedList> fetchList(SocialListKind kind, String owner) {
        RelayFilter filter = switch (kind) {
            case FOLLOWS -> RelayFilter.kind(EventKind.CONTACTS).author(owner);
            case FAVORITES -> RelayFilter.kind(EventKind.FOLLOW_SET).author(owner).ref(EventKind.CLUBHOUSE_SET);
            case INBOX_RELAYS -> RelayFilter.kind(EventKind.INBOX_RELAYS).author(owner);
        };
        String tagName = kind == SocialListKind.INBOX_RELAYS ? "relay" : "p";
        return relays.query(filter)
                .reduce(ThreeTierIdentityCache::newer)
                .map(e -> new CachedList(kind, owner, List.copyOf(new LinkedHashSet<>(e.tagValues(tagName))),
                        e.createdInstant()))
                .onErrorResume(err -> {
                    log.warn("{} fetch for {} failed: {}", kind, owner, err.toString());
                    return Mono.empty();
                });
    }

    private Profile parseProfile(RelayEvent event) {
        JsonNode content;
        try {
            content = mapper.readTree(event.content());
        } catch (JsonProcessingException e) {
            log.debug("Profile event {} has non-JSON content", event.id());
            return null;
        }
        if (content == null || !content.isObject()) {
            return null;
        }
        String displayName = text(content, "display_name");
        if (displayName == null) {
            displayName = text(content, "displayName");
        }
        return new Profile(event.pubkey(), text(content, "name"), displayName, text(content, "about"),
                text(content, "picture"), text(content, "banner"), text(content, "nip05"), event.createdInstant());
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.textValue() : null;
    }

    private static RelayEvent newer(RelayEvent a, RelayEvent b) {
        Comparator<RelayEvent> order = Comparator.comparingLong(RelayEvent::createdAt).thenComparing(RelayEvent::id);
        return order.compare(a, b) >= 0 ? a : b;
    }

    private record ListKey(SocialListKind kind, String owner) {
    }
}
