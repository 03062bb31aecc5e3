package com.raid.roundsync.r2dbc.store;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.raid.roundsync.core.model.JoinedVia;
import com.raid.roundsync.core.model.Round;
import com.raid.roundsync.core.model.RoundPlayer;
import com.raid.roundsync.core.model.ScoringMode;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access for rounds, round_players and round_completions. Joined rounds also get
 * their round_network_records row here.
 */
@Repository
public class RoundStore {

	private static final String ROUND_COLUMNS = "r.round_id, r.course_hash, r.round_date, r.scoring_mode, r.created_at, c.completed_at";

	private final DatabaseClient db;
	private final TransactionalOperator tx;
	private final LocalWriteQueue writes;

	public RoundStore(DatabaseClient db, TransactionalOperator tx, LocalWriteQueue writes) {
		this.db = db;
		this.tx = tx;
		this.writes = writes;
	}

	/**
	 * Inserts the round and all of its players in one transaction. {@code playerKeys.get(i)}
	 * becomes player index {@code i}.
	 */
	public Mono<Round> insertWithPlayers(String courseHash, LocalDate roundDate, ScoringMode mode,
			List<String> playerKeys, Instant now) {
		Mono<Round> write = roundWithPlayers(courseHash, roundDate, mode, playerKeys, now).as(tx::transactional);
		return writes.submit("create round on " + courseHash, write);
	}

	/**
	 * Inserts a joined multi-device round, its players and its round_network_records row in one
	 * transaction, so a round joined from an initiation never exists without that binding.
	 */
	public Mono<Round> insertJoined(String courseHash, LocalDate roundDate, List<String> playerKeys,
			String initiationEventId, Instant now) {
		Mono<Round> write = roundWithPlayers(courseHash, roundDate, ScoringMode.MULTI_DEVICE, playerKeys, now)
				.flatMap(round -> db
						.sql("INSERT INTO round_network_records (round_id, initiation_event_id, joined_via, created_at) "
								+ "VALUES (:id, :eid, :via, :at)")
						.bind("id", round.roundId()).bind("eid", initiationEventId).bind("via", JoinedVia.JOINED.value())
						.bind("at", now.toEpochMilli()).fetch().rowsUpdated().thenReturn(round))
				.as(tx::transactional);
		return writes.submit("join round " + initiationEventId, write);
	}

	private Mono<Round> roundWithPlayers(String courseHash, LocalDate roundDate, ScoringMode mode,
			List<String> playerKeys, Instant now) {
		Mono<Long> insertRound = db
				.sql("INSERT INTO rounds (course_hash, round_date, scoring_mode, created_at) "
						+ "VALUES (:course_hash, :round_date, :mode, :created_at)")
				.bind("course_hash", courseHash).bind("round_date", roundDate.toString()).bind("mode", mode.name())
				.bind("created_at", now.toEpochMilli()).filter(s -> s.returnGeneratedValues())
				.map((row, meta) -> row.get(0, Long.class)).one();

		return insertRound.flatMap(roundId -> Flux.range(0, playerKeys.size())
				.concatMap(i -> db
						.sql("INSERT INTO round_players (round_id, player_index, player_pubkey) VALUES (:round_id, :idx, :pk)")
						.bind("round_id", roundId).bind("idx", i).bind("pk", playerKeys.get(i)).fetch().rowsUpdated())
				.then(Mono.just(new Round(roundId, courseHash, roundDate, mode, Instant.ofEpochMilli(now.toEpochMilli()), null))));
	}

	public Mono<Round> findById(long roundId) {
		String sql = "SELECT " + ROUND_COLUMNS
				+ " FROM rounds r LEFT JOIN round_completions c ON c.round_id = r.round_id WHERE r.round_id = :id";
		return db.sql(sql).bind("id", roundId).map((row, meta) -> toRound(row)).one();
	}

	public Flux<Round> findAll() {
		String sql = "SELECT " + ROUND_COLUMNS
				+ " FROM rounds r LEFT JOIN round_completions c ON c.round_id = r.round_id ORDER BY r.round_id DESC";
		return db.sql(sql).map((row, meta) -> toRound(row)).all();
	}

	public Flux<RoundPlayer> players(long roundId) {
		String sql = "SELECT round_id, player_index, player_pubkey FROM round_players WHERE round_id = :id ORDER BY player_index";
		return db.sql(sql).bind("id", roundId)
				.map((row, meta) -> new RoundPlayer(row.get("round_id", Long.class), row.get("player_index", Integer.class),
						row.get("player_pubkey", String.class).trim()))
				.all();
	}

	/**
	 * Records completion once; later calls keep the first timestamp.
	 */
	public Mono<Round> markCompleted(long roundId, Instant now) {
		Mono<Round> write = db.sql("SELECT COUNT(*) AS n FROM round_completions WHERE round_id = :id").bind("id", roundId)
				.map((row, meta) -> row.get("n", Long.class)).one()
				.flatMap(n -> n > 0 ? Mono.just(0L)
						: db.sql("INSERT INTO round_completions (round_id, completed_at) VALUES (:id, :at)")
								.bind("id", roundId).bind("at", now.toEpochMilli()).fetch().rowsUpdated())
				.then(findById(roundId));
		return writes.submit("complete round " + roundId, write);
	}

	private static Round toRound(Row row) {
		Long completed = row.get("completed_at", Long.class);
		return new Round(row.get("round_id", Long.class), row.get("course_hash", String.class).trim(),
				LocalDate.parse(row.get("round_date", String.class)),
				ScoringMode.valueOf(row.get("scoring_mode", String.class)),
				Instant.ofEpochMilli(row.get("created_at", Long.class)),
				completed == null ? null : Instant.ofEpochMilli(completed));
	}
}
