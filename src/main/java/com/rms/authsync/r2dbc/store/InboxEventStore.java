package com.rms.authsync.r2dbc.store;

import java.time.Instant;
import java.time.OffsetDateTime;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.rms.authsync.core.model.InboxRecord;
import com.rms.authsync.core.model.InboxState;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * SQL access to the {@code event_inbox} table.
 *
 * Timestamps are written with {@code CURRENT_TIMESTAMP} on the database side and read back as
 * {@link OffsetDateTime}; the envelope payload is plain JSON text so the same statements run on
 * PostgreSQL and H2.
 */
@Repository
public class InboxEventStore {

	private static final String COLUMNS = "event_id, subject, source, stream, consumer_name, payload, processed_at, "
			+ "last_error, attempts, parked_at, created_at, updated_at";

	private final DatabaseClient db;

	public InboxEventStore(DatabaseClient db) {
		this.db = db;
	}

	/**
	 * Inserts the row unless one with the same event id exists. Returns the number of rows inserted.
	 */
	public Mono<Long> insertIfAbsent(InboxRecord record) {
		String sql = "INSERT INTO event_inbox (event_id, subject, source, stream, consumer_name, payload) "
				+ "VALUES (:event_id, :subject, :source, :stream, :consumer_name, :payload) ON CONFLICT DO NOTHING";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("event_id", record.eventId())
				.bind("subject", record.subject());
		spec = bindNullable(spec, "source", record.source());
		spec = bindNullable(spec, "stream", record.stream());
		spec = bindNullable(spec, "consumer_name", record.consumerName());
		spec = bindNullable(spec, "payload", record.payload());

		return spec.fetch().rowsUpdated();
	}

	/**
	 * Locks the row for the rest of the surrounding transaction and reports whether it has already
	 * been processed. Empty when the row does not exist.
	 */
	public Mono<Boolean> lockAndCheckProcessed(String eventId) {
		String sql = "SELECT event_id, processed_at FROM event_inbox WHERE event_id = :event_id FOR UPDATE";
		return db.sql(sql).bind("event_id", eventId).map((row, meta) -> row.get("processed_at") != null).one();
	}

	public Mono<Long> markProcessed(String eventId) {
		String sql = "UPDATE event_inbox SET processed_at = CURRENT_TIMESTAMP, last_error = NULL, "
				+ "updated_at = CURRENT_TIMESTAMP WHERE event_id = :event_id";
		return db.sql(sql).bind("event_id", eventId).fetch().rowsUpdated();
	}

	public Mono<Long> recordFailure(String eventId, String error) {
		String sql = "UPDATE event_inbox SET last_error = :last_error, attempts = attempts + 1, "
				+ "updated_at = CURRENT_TIMESTAMP WHERE event_id = :event_id AND processed_at IS NULL";
		return db.sql(sql).bind("last_error", error).bind("event_id", eventId).fetch().rowsUpdated();
	}

	public Mono<Long> park(String eventId, String reason) {
		String sql = "UPDATE event_inbox SET last_error = :last_error, parked_at = CURRENT_TIMESTAMP, "
				+ "updated_at = CURRENT_TIMESTAMP WHERE event_id = :event_id AND processed_at IS NULL";
		return db.sql(sql).bind("last_error", reason).bind("event_id", eventId).fetch().rowsUpdated();
	}

	public Mono<InboxRecord> findById(String eventId) {
		String sql = "SELECT " + COLUMNS + " FROM event_inbox WHERE event_id = :event_id";
		return db.sql(sql).bind("event_id", eventId).map((row, meta) -> toModel(row)).one();
	}

	public Flux<InboxRecord> findByState(InboxState state, int limit) {
		String where = switch (state) {
			case PROCESSED -> "processed_at IS NOT NULL";
			case PARKED -> "processed_at IS NULL AND parked_at IS NOT NULL";
			case FAILED -> "processed_at IS NULL AND parked_at IS NULL AND last_error IS NOT NULL";
			case PENDING -> "processed_at IS NULL AND parked_at IS NULL AND last_error IS NULL";
		};
		String sql = "SELECT " + COLUMNS + " FROM event_inbox WHERE " + where
				+ " ORDER BY updated_at DESC LIMIT :limit";
		return db.sql(sql).bind("limit", limit).map((row, meta) -> toModel(row)).all();
	}

	private static InboxRecord toModel(Row row) {
		Integer attempts = row.get("attempts", Integer.class);
		return new InboxRecord(row.get("event_id", String.class), row.get("subject", String.class),
				row.get("source", String.class), row.get("stream", String.class),
				row.get("consumer_name", String.class), row.get("payload", String.class),
				instant(row, "processed_at"), row.get("last_error", String.class), attempts == null ? 0 : attempts,
				instant(row, "parked_at"), instant(row, "created_at"), instant(row, "updated_at"));
	}

	private static Instant instant(Row row, String column) {
		OffsetDateTime v = row.get(column, OffsetDateTime.class);
		return v == null ? null : v.toInstant();
	}

	static DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec, String name,
			String value) {
		return value == null ? spec.bindNull(name, String.class) : spec.bind(name, value);
	}
}
