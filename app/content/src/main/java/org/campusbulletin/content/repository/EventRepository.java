/*
 * Where: content data access
 * What: events rows for authoring, live reads and cleanup
 * Why: SQL only narrows candidates; liveness is decided by ExpirationPolicy in the service layer
 */
package org.campusbulletin.content.repository;

import static org.campusbulletin.common.JdbcTimestampUtils.toInstant;
import static org.campusbulletin.common.JdbcTimestampUtils.toLocalDate;
import static org.campusbulletin.common.JdbcTimestampUtils.toSqlDate;
import static org.campusbulletin.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.model.EventRecord;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EventRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT event_id, title, description, event_date, start_time, end_time, location, organizer,
             registration_deadline, expires_at, is_published, created_by, created_at, updated_at
      FROM events
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(EventRecord record) {
    final String sql =
        """
        INSERT INTO events (
          event_id, title, description, event_date, start_time, end_time, location, organizer,
          registration_deadline, expires_at, is_published, created_by, created_at, updated_at
        ) VALUES (
          :eventId, :title, :description, :eventDate, :startTime, :endTime, :location, :organizer,
          :registrationDeadline, :expiresAt, :published, :createdBy, :createdAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", record.eventId())
            .addValue("title", record.title())
            .addValue("description", record.description())
            .addValue("eventDate", toSqlDate(record.eventDate()))
            .addValue("startTime", record.startTime(), Types.TIME)
            .addValue("endTime", record.endTime(), Types.TIME)
            .addValue("location", record.location(), Types.VARCHAR)
            .addValue("organizer", record.organizer(), Types.VARCHAR)
            .addValue(
                "registrationDeadline", toTimestamp(record.registrationDeadline()), Types.TIMESTAMP)
            .addValue("expiresAt", toTimestamp(record.expiresAt()), Types.TIMESTAMP)
            .addValue("published", record.published())
            .addValue("createdBy", record.createdBy(), Types.OTHER)
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
    return record.eventId();
  }

  public Optional<EventRecord> findById(UUID eventId) {
    final String sql = SELECT_COLUMNS + "WHERE event_id = :eventId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Published events whose explicit expiry, if any, is still ahead of {@code now}. */
  public List<EventRecord> findPublishedCandidates(Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE is_published = TRUE
              AND (expires_at IS NULL OR expires_at > :now)
            ORDER BY event_date, created_at DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int updatePublication(UUID eventId, boolean published, Instant expiresAt, Instant updatedAt) {
    final String sql =
        """
        UPDATE events
        SET is_published = :published,
            expires_at = :expiresAt,
            updated_at = :updatedAt
        WHERE event_id = :eventId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("published", published)
            .addValue("expiresAt", toTimestamp(expiresAt), Types.TIMESTAMP)
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("eventId", eventId);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Locks events dated before {@code today}; only those can be past both their date and their
   * expiry. Rows locked by a concurrent sweep are skipped. Must run inside a transaction.
   */
  public List<EventRecord> lockExpiryCandidates(LocalDate today) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE event_date < :today
            ORDER BY event_date
            FOR UPDATE SKIP LOCKED
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("today", toSqlDate(today));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteByIds(Collection<UUID> eventIds) {
    if (eventIds.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM events WHERE event_id IN (:ids)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", eventIds);
    return jdbcTemplate.update(sql, params);
  }

  private EventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new EventRecord(
        rs.getObject("event_id", UUID.class),
        rs.getString("title"),
        rs.getString("description"),
        toLocalDate(rs.getDate("event_date")),
        rs.getObject("start_time", LocalTime.class),
        rs.getObject("end_time", LocalTime.class),
        rs.getString("location"),
        rs.getString("organizer"),
        toInstant(rs.getTimestamp("registration_deadline")),
        toInstant(rs.getTimestamp("expires_at")),
        rs.getBoolean("is_published"),
        rs.getObject("created_by", UUID.class),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
