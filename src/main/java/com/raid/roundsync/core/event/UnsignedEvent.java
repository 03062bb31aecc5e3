package com.raid.roundsync.core.event;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.raid.roundsync.core.canonical.CanonicalJson;
import com.raid.roundsync.core.canonical.ContentHasher;

/**
 * An event before signing. Its id is the SHA-256 of
 * {@code [0, pubkey, created_at, kind, tags, content]} in canonical JSON.
 *
 * @param createdAt seconds since the epoch
 */
public record UnsignedEvent(
        String pubkey,
        long createdAt,
        int kind,
        List<List<String>> tags,
        String content
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public UnsignedEvent {
        Objects.requireNonNull(pubkey, "pubkey");
        tags = Tags.copyOf(tags);
        content = content == null ? "" : content;
    }

    public String computeId() {
        return computeId(pubkey, createdAt, kind, tags, content);
    }

    static String computeId(String pubkey, long createdAt, int kind, List<List<String>> tags, String content) {
        ArrayNode arr = JsonNodeFactory.instance.arrayNode();
        arr.add(0);
        arr.add(pubkey);
        arr.add(createdAt);
        arr.add(kind);
        arr.add(MAPPER.valueToTree(tags));
        arr.add(content);
        return ContentHasher.sha256Hex(CanonicalJson.write(arr));
    }

    /** The unsigned form carried inside a seal; it keeps its id but never gets a signature. */
    public RelayEvent asRumor() {
        return new RelayEvent(computeId(), pubkey, createdAt, kind, tags, content, null);
    }
}
