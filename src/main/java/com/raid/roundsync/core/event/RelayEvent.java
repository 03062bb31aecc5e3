package com.raid.roundsync.core.event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A signed event as stored on and served by relays. Rumors (the innermost layer of a gift
 * wrap) use the same shape with a null {@code sig}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelayEvent(
        String id,
        String pubkey,
        @JsonProperty("created_at") long createdAt,
        int kind,
        List<List<String>> tags,
        String content,
        String sig
) {

    public RelayEvent {
        tags = tags == null ? List.of() : Tags.copyOf(tags);
        content = content == null ? "" : content;
    }

    /** Whether {@link #id()} matches the id recomputed from the other fields. */
    @JsonIgnore
    public boolean hasValidId() {
        return id != null && id.equals(UnsignedEvent.computeId(pubkey, createdAt, kind, tags, content));
    }

    @JsonIgnore
    public Instant createdInstant() {
        return Instant.ofEpochSecond(createdAt);
    }

    public Optional<String> firstTag(String name) {
        return Tags.first(tags, name);
    }

    public List<String> tagValues(String name) {
        return Tags.values(tags, name);
    }

    /** The {@code d} tag of an addressable event, empty string when absent. */
    @JsonIgnore
    public String identifier() {
        return firstTag("d").orElse("");
    }
}
