package com.raid.roundsync.r2dbc.store;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.raid.roundsync.core.model.JoinedVia;
import com.raid.roundsync.core.model.RoundNetworkRecord;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Mono;

/**
 * One-shot guard for a round's network identity (round_network_records), plus the per-player
 * final record ids (round_final_records).
 */
@Repository
public class RoundNetworkStore {

	private static final Logger log = LoggerFactory.getLogger(RoundNetworkStore.class);

	private final DatabaseClient db;
	private final LocalWriteQueue writes;

	public RoundNetworkStore(DatabaseClient db, LocalWriteQueue writes) {
		this.db = db;
		this.writes = writes;
	}

	public Mono<RoundNetworkRecord> findByRoundId(long roundId) {
		return db.sql("SELECT round_id, initiation_event_id, joined_via, created_at FROM round_network_records WHERE round_id = :id")
				.bind("id", roundId).map((row, meta) -> toRecord(row)).one();
	}

	public Mono<RoundNetworkRecord> findByInitiationEventId(String eventId) {
		return db.sql("SELECT round_id, initiation_event_id, joined_via, created_at FROM round_network_records "
				+ "WHERE initiation_event_id = :eid").bind("eid", eventId).map((row, meta) -> toRecord(row)).one();
	}

	/**
	 * Writes the record unless one exists for the round. Emits whichever record is stored
	 * afterwards, so a losing writer learns the winning id.
	 */
	public Mono<RoundNetworkRecord> insertIfAbsent(long roundId, String initiationEventId, JoinedVia joinedVia, Instant now) {
		Mono<RoundNetworkRecord> write = findByRoundId(roundId)
				.doOnNext(existing -> {
					if (!existing.initiationEventId().equals(initiationEventId)) {
						log.warn("Round {} already bound to initiation {}; keeping it over {}", roundId,
								existing.initiationEventId(), initiationEventId);
					}
				})
				.switchIfEmpty(Mono.defer(() -> db
						.sql("INSERT INTO round_network_records (round_id, initiation_event_id, joined_via, created_at) "
								+ "VALUES (:id, :eid, :via, :at)")
						.bind("id", roundId).bind("eid", initiationEventId).bind("via", joinedVia.value())
						.bind("at", now.toEpochMilli()).fetch().rowsUpdated()
						.then(Mono.just(new RoundNetworkRecord(roundId, initiationEventId, joinedVia,
								Instant.ofEpochMilli(now.toEpochMilli()))))));
		return writes.submit("bind round " + roundId + " to " + initiationEventId, write);
	}

	public Mono<String> findFinalRecordId(long roundId, int playerIndex) {
		return db.sql("SELECT event_id FROM round_final_records WHERE round_id = :id AND player_index = :idx")
				.bind("id", roundId).bind("idx", playerIndex).map((row, meta) -> row.get("event_id", String.class).trim())
				.one();
	}

	/** Remembers a published final record; the first id stored for a player is kept. */
	public Mono<String> saveFinalRecordId(long roundId, int playerIndex, String eventId, Instant now) {
		Mono<String> write = findFinalRecordId(roundId, playerIndex)
				.switchIfEmpty(Mono.defer(() -> db
						.sql("INSERT INTO round_final_records (round_id, player_index, event_id, published_at) "
								+ "VALUES (:id, :idx, :eid, :at)")
						.bind("id", roundId).bind("idx", playerIndex).bind("eid", eventId).bind("at", now.toEpochMilli())
						.fetch().rowsUpdated().thenReturn(eventId)));
		return writes.submit("final record round=" + roundId + " player=" + playerIndex, write);
	}

	private static RoundNetworkRecord toRecord(Row row) {
		return new RoundNetworkRecord(row.get("round_id", Long.class), row.get("initiation_event_id", String.class).trim(),
				JoinedVia.fromValue(row.get("joined_via", String.class)),
				Instant.ofEpochMilli(row.get("created_at", Long.class)));
	}
}
