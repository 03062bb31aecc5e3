package com.raid.roundsync.r2dbc.store;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.raid.roundsync.core.model.Profile;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Mono;

/**
 * Durable tier of the profile cache (cached_profiles).
 */
@Repository
public class ProfileCacheStore {

	private static final String COLUMNS = "pubkey, name, display_name, about, picture, banner, nip05, event_created_at";

	private final DatabaseClient db;
	private final LocalWriteQueue writes;

	public ProfileCacheStore(DatabaseClient db, LocalWriteQueue writes) {
		this.db = db;
		this.writes = writes;
	}

	public Mono<Profile> find(String publicKeyHex) {
		return db.sql("SELECT " + COLUMNS + " FROM cached_profiles WHERE pubkey = :pk").bind("pk", publicKeyHex)
				.map((row, meta) -> toProfile(row)).one();
	}

	/** Replaces the row for the profile's key. Callers merge before saving. */
	public Mono<Profile> save(Profile profile, Instant now) {
		String sql = "MERGE INTO cached_profiles (" + COLUMNS + ", cached_at) KEY (pubkey) "
				+ "VALUES (:pk, :name, :display, :about, :picture, :banner, :nip05, :created, :cached)";
		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("pk", profile.publicKeyHex())
				.bind("created", profile.eventCreatedAt().toEpochMilli()).bind("cached", now.toEpochMilli());
		spec = bindNullable(spec, "name", profile.name());
		spec = bindNullable(spec, "display", profile.displayName());
		spec = bindNullable(spec, "about", profile.about());
		spec = bindNullable(spec, "picture", profile.picture());
		spec = bindNullable(spec, "banner", profile.banner());
		spec = bindNullable(spec, "nip05", profile.nip05());
		return writes.submit("profile " + Profile.shortKey(profile.publicKeyHex()),
				spec.fetch().rowsUpdated().thenReturn(profile));
	}

	private static DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec, String name,
			String value) {
		return value == null ? spec.bindNull(name, String.class) : spec.bind(name, value);
	}

	private static Profile toProfile(Row row) {
		return new Profile(row.get("pubkey", String.class).trim(), row.get("name", String.class),
				row.get("display_name", String.class), row.get("about", String.class), row.get("picture", String.class),
				row.get("banner", String.class), row.get("nip05", String.class),
				Instant.ofEpochMilli(row.get("event_created_at", Long.class)));
	}
}
