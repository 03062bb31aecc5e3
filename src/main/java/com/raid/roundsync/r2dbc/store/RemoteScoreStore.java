package com.raid.roundsync.r2dbc.store;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raid.roundsync.core.model.RemotePlayerScores;
import com.raid.roundsync.core.model.ScorecardStatus;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Side table of remote players' progress. Never touches hole_scores.
 *
 * Scores are stored as a JSON object {"hole": strokes}, bound and read as String.
 */
@Repository
public class RemoteScoreStore {

	private static final TypeReference<Map<Integer, Integer>> SCORES = new TypeReference<>() {
	};

	private final DatabaseClient db;
	private final ObjectMapper mapper;
	private final LocalWriteQueue writes;

	public RemoteScoreStore(DatabaseClient db, ObjectMapper mapper, LocalWriteQueue writes) {
		this.db = db;
		this.mapper = mapper;
		this.writes = writes;
	}

	public Flux<RemotePlayerScores> findByRound(long roundId) {
		String sql = "SELECT round_id, player_pubkey, scores_json, status, source_event_id, event_created_at, source_kind "
				+ "FROM remote_scores WHERE round_id = :id";
		return db.sql(sql).bind("id", roundId).map((row, meta) -> toModel(row)).all();
	}

	public Mono<RemotePlayerScores> find(long roundId, String playerPubkey) {
		String sql = "SELECT round_id, player_pubkey, scores_json, status, source_event_id, event_created_at, source_kind "
				+ "FROM remote_scores WHERE round_id = :id AND player_pubkey = :pk";
		return db.sql(sql).bind("id", roundId).bind("pk", playerPubkey).map((row, meta) -> toModel(row)).one();
	}

	/**
	 * Stores {@code incoming} if it supersedes what is cached for that player. Emits the row that
	 * is cached afterwards.
	 */
	public Mono<RemotePlayerScores> upsertIfNewer(RemotePlayerScores incoming, Instant now) {
		Mono<RemotePlayerScores> write = find(incoming.roundId(), incoming.playerPublicKeyHex())
				.map(Optional::of)
				.defaultIfEmpty(Optional.empty())
				.flatMap(current -> {
					if (!incoming.supersedes(current.orElse(null))) {
						return Mono.just(current.get());
					}
					String sql = "MERGE INTO remote_scores (round_id, player_pubkey, scores_json, status, source_event_id, "
							+ "event_created_at, source_kind, fetched_at) KEY (round_id, player_pubkey) "
							+ "VALUES (:id, :pk, :scores, :status, :eid, :created, :source, :fetched)";
					return db.sql(sql).bind("id", incoming.roundId()).bind("pk", incoming.playerPublicKeyHex())
							.bind("scores", write(incoming.scores())).bind("status", incoming.status().name())
							.bind("eid", incoming.sourceEventId()).bind("created", incoming.eventCreatedAt().toEpochMilli())
							.bind("source", incoming.fromFinalRecord() ? "final" : "live")
							.bind("fetched", now.toEpochMilli()).fetch().rowsUpdated().thenReturn(incoming);
				});
		return writes.submit("remote scores round=" + incoming.roundId() + " player=" + incoming.playerPublicKeyHex(), write);
	}

	private RemotePlayerScores toModel(Row row) {
		Map<Integer, Integer> scores;
		try {
			scores = mapper.readValue(row.get("scores_json", String.class), SCORES);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Corrupt remote_scores row", e);
		}
		return new RemotePlayerScores(row.get("round_id", Long.class), row.get("player_pubkey", String.class).trim(),
				scores == null ? new HashMap<>() : scores, ScorecardStatus.valueOf(row.get("status", String.class)),
				row.get("source_event_id", String.class).trim(), "final".equals(row.get("source_kind", String.class)),
				Instant.ofEpochMilli(row.get("event_created_at", Long.class)));
	}

	private String write(Map<Integer, Integer> scores) {
		try {
			return mapper.writeValueAsString(scores);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Failed to serialize scores to JSON", e);
		}
	}
}
