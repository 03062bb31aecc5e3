package com.raid.roundsync.r2dbc.store;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.raid.roundsync.core.model.HoleScoreEvent;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only access to hole_scores. There is no update or delete.
 */
@Repository
public class HoleScoreStore {

	/** Latest row wins: highest recorded_at, then highest score_id. */
	static final Comparator<HoleScoreEvent> LATEST = Comparator.comparing(HoleScoreEvent::recordedAt)
			.thenComparingLong(HoleScoreEvent::scoreId);

	private final DatabaseClient db;
	private final LocalWriteQueue writes;

	public HoleScoreStore(DatabaseClient db, LocalWriteQueue writes) {
		this.db = db;
		this.writes = writes;
	}

	public Mono<HoleScoreEvent> append(long roundId, int playerIndex, int holeNumber, int strokes, Instant recordedAt) {
		long at = recordedAt.toEpochMilli();
		Mono<HoleScoreEvent> write = db
				.sql("INSERT INTO hole_scores (round_id, player_index, hole_number, strokes, recorded_at) "
						+ "VALUES (:round_id, :idx, :hole, :strokes, :at)")
				.bind("round_id", roundId).bind("idx", playerIndex).bind("hole", holeNumber).bind("strokes", strokes)
				.bind("at", at).filter(s -> s.returnGeneratedValues())
				.map((row, meta) -> row.get(0, Long.class)).one()
				.map(id -> new HoleScoreEvent(id, roundId, playerIndex, holeNumber, strokes, Instant.ofEpochMilli(at)));
		return writes.submit("append score round=" + roundId + " player=" + playerIndex + " hole=" + holeNumber, write);
	}

	public Flux<HoleScoreEvent> events(long roundId, int playerIndex) {
		String sql = "SELECT score_id, round_id, player_index, hole_number, strokes, recorded_at FROM hole_scores "
				+ "WHERE round_id = :round_id AND player_index = :idx ORDER BY score_id";
		return db.sql(sql).bind("round_id", roundId).bind("idx", playerIndex)
				.map((row, meta) -> new HoleScoreEvent(row.get("score_id", Long.class), row.get("round_id", Long.class),
						row.get("player_index", Integer.class), row.get("hole_number", Integer.class),
						row.get("strokes", Integer.class), Instant.ofEpochMilli(row.get("recorded_at", Long.class))))
				.all();
	}

	/**
	 * Current strokes per hole: the latest row of each hole. Holes without rows are absent.
	 */
	public Mono<Map<Integer, Integer>> currentScores(long roundId, int playerIndex) {
		return events(roundId, playerIndex).collectList().map(HoleScoreStore::resolveLatest);
	}

	/** Holes with at least one row. */
	public Mono<Set<Integer>> scoredHoles(long roundId, int playerIndex) {
		String sql = "SELECT DISTINCT hole_number FROM hole_scores WHERE round_id = :round_id AND player_index = :idx";
		return db.sql(sql).bind("round_id", roundId).bind("idx", playerIndex)
				.map((row, meta) -> row.get("hole_number", Integer.class)).all()
				.<Set<Integer>>collect(TreeSet::new, Set::add);
	}

	static Map<Integer, Integer> resolveLatest(Iterable<HoleScoreEvent> events) {
		Map<Integer, HoleScoreEvent> latest = new TreeMap<>();
		for (HoleScoreEvent e : events) {
			latest.merge(e.holeNumber(), e, (a, b) -> LATEST.compare(a, b) >= 0 ? a : b);
		}
		Map<Integer, Integer> out = new TreeMap<>();
		latest.forEach((hole, e) -> out.put(hole, e.strokes()));
		return out;
	}
}
