package com.raid.roundsync.r2dbc.store;

import java.time.Instant;
import java.util.List;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raid.roundsync.core.model.CachedList;
import com.raid.roundsync.core.model.SocialListKind;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Mono;

/**
 * Durable tier for follow lists, favorites and inbox relay lists. One table per list kind,
 * members stored as a JSON array in list order.
 */
@Repository
public class SocialListCacheStore {

	private static final TypeReference<List<String>> MEMBERS = new TypeReference<>() {
	};

	private final DatabaseClient db;
	private final ObjectMapper mapper;
	private final LocalWriteQueue writes;

	public SocialListCacheStore(DatabaseClient db, ObjectMapper mapper, LocalWriteQueue writes) {
		this.db = db;
		this.mapper = mapper;
		this.writes = writes;
	}

	public Mono<CachedList> find(SocialListKind kind, String ownerPublicKeyHex) {
		return db.sql("SELECT owner_pubkey, members_json, event_created_at FROM " + table(kind) + " WHERE owner_pubkey = :pk")
				.bind("pk", ownerPublicKeyHex).map((row, meta) -> toList(kind, row)).one();
	}

	public Mono<CachedList> save(CachedList list, Instant now) {
		String sql = "MERGE INTO " + table(list.kind()) + " (owner_pubkey, members_json, event_created_at, cached_at) "
				+ "KEY (owner_pubkey) VALUES (:pk, :members, :created, :cached)";
		Mono<CachedList> write = db.sql(sql).bind("pk", list.ownerPublicKeyHex()).bind("members", write(list.members()))
				.bind("created", list.eventCreatedAt().toEpochMilli()).bind("cached", now.toEpochMilli()).fetch()
				.rowsUpdated().thenReturn(list);
		return writes.submit(list.kind() + " of " + list.ownerPublicKeyHex(), write);
	}

	static String table(SocialListKind kind) {
		switch (kind) {
		case FOLLOWS:
			return "cached_follow_lists";
		case FAVORITES:
			return "cached_favorites";
		case INBOX_RELAYS:
			return "cached_relay_lists";
		default:
			throw new IllegalArgumentException("Unknown list kind: " + kind);
		}
	}

	private CachedList toList(SocialListKind kind, Row row) {
		List<String> members;
		try {
			members = mapper.readValue(row.get("members_json", String.class), MEMBERS);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Corrupt " + table(kind) + " row", e);
		}
		return new CachedList(kind, row.get("owner_pubkey", String.class).trim(), members,
				Instant.ofEpochMilli(row.get("event_created_at", Long.class)));
	}

	private String write(List<String> members) {
		try {
			return mapper.writeValueAsString(members);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Failed to serialize list members to JSON", e);
		}
	}
}
