package com.raid.roundsync.r2dbc.store;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.raid.roundsync.core.canonical.CanonicalJson;
import com.raid.roundsync.core.event.RoundContent;
import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.HoleDefinition;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access for course_snapshots and course_holes. Rows are inserted once and never
 * updated.
 */
@Repository
public class CourseSnapshotStore {

	private final DatabaseClient db;
	private final TransactionalOperator tx;
	private final LocalWriteQueue writes;

	public CourseSnapshotStore(DatabaseClient db, TransactionalOperator tx, LocalWriteQueue writes) {
		this.db = db;
		this.tx = tx;
		this.writes = writes;
	}

	/**
	 * Inserts the snapshot and its holes in one transaction unless a row with the same hash
	 * exists. Emits the stored snapshot either way.
	 */
	public Mono<CourseSnapshot> insertIfAbsent(CourseSnapshot course, Instant now) {
		Mono<CourseSnapshot> write = exists(course.contentHash()).flatMap(found -> {
			if (found) {
				return Mono.just(course);
			}
			String sql = "INSERT INTO course_snapshots (content_hash, course_name, tee_set, hole_count, canonical_json, created_at) "
					+ "VALUES (:hash, :name, :tee, :count, :json, :created_at)";
			Mono<Long> header = db.sql(sql).bind("hash", course.contentHash()).bind("name", course.courseName())
					.bind("tee", course.teeSetName()).bind("count", course.holeCount())
					.bind("json", CanonicalJson.write(RoundContent.courseNode(course)))
					.bind("created_at", now.toEpochMilli()).fetch().rowsUpdated();
			Flux<Long> holes = Flux.fromIterable(course.holes()).concatMap(h -> db
					.sql("INSERT INTO course_holes (content_hash, hole_number, par) VALUES (:hash, :hole, :par)")
					.bind("hash", course.contentHash()).bind("hole", h.holeNumber()).bind("par", h.par()).fetch()
					.rowsUpdated());
			return header.thenMany(holes).then(Mono.just(course)).as(tx::transactional);
		});
		return writes.submit("insert course " + course.contentHash(), write);
	}

	public Mono<CourseSnapshot> findByHash(String contentHash) {
		String sql = "SELECT content_hash, course_name, tee_set FROM course_snapshots WHERE content_hash = :hash";
		return db.sql(sql).bind("hash", contentHash)
				.map((row, meta) -> new Header(row.get("content_hash", String.class).trim(),
						row.get("course_name", String.class), row.get("tee_set", String.class)))
				.one()
				.flatMap(h -> holes(contentHash).collectList()
						.map(holes -> new CourseSnapshot(h.hash(), h.name(), h.tee(), holes)));
	}

	public Mono<Long> count() {
		return db.sql("SELECT COUNT(*) AS n FROM course_snapshots").map((row, meta) -> row.get("n", Long.class)).one();
	}

	private Mono<Boolean> exists(String contentHash) {
		return db.sql("SELECT COUNT(*) AS n FROM course_snapshots WHERE content_hash = :hash")
				.bind("hash", contentHash).map((row, meta) -> row.get("n", Long.class)).one().map(n -> n > 0);
	}

	private Flux<HoleDefinition> holes(String contentHash) {
		String sql = "SELECT hole_number, par FROM course_holes WHERE content_hash = :hash ORDER BY hole_number";
		return db.sql(sql).bind("hash", contentHash).map(
				(row, meta) -> new HoleDefinition(row.get("hole_number", Integer.class), row.get("par", Integer.class)))
				.all();
	}

	private record Header(String hash, String name, String tee) {
	}
}
