/*
 * Where: content data access
 * What: Inserts, reads, edits and sweeps notifications rows
 * Why: Backs notification authoring, fan-out bookkeeping and cleanup
 */
package org.campusbulletin.content.repository;

import static org.campusbulletin.common.JdbcTimestampUtils.toInstant;
import static org.campusbulletin.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.model.NotificationPriority;
import org.campusbulletin.content.model.NotificationRecord;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id, title, body, category, priority,
             payload_json::text AS payload_json_text, targeting_json::text AS targeting_json_text,
             is_published, expires_at, send_count, created_by, created_at, updated_at
      FROM notifications
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          title,
          body,
          category,
          priority,
          payload_json,
          targeting_json,
          is_published,
          expires_at,
          send_count,
          created_by,
          created_at,
          updated_at
        ) VALUES (
          :notificationId,
          :title,
          :body,
          :category,
          :priority,
          :payloadJson::jsonb,
          :targetingJson::jsonb,
          :published,
          :expiresAt,
          :sendCount,
          :createdBy,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("title", record.title())
            .addValue("body", record.body())
            .addValue("category", record.category())
            .addValue("priority", record.priority().name())
            .addValue("payloadJson", record.payloadJson(), Types.VARCHAR)
            .addValue("targetingJson", record.targetingJson())
            .addValue("published", record.published())
            .addValue("expiresAt", toTimestamp(record.expiresAt()), Types.TIMESTAMP)
            .addValue("sendCount", record.sendCount())
            .addValue("createdBy", record.createdBy(), Types.OTHER)
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    final String sql = SELECT_COLUMNS + "WHERE notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean exists(UUID notificationId) {
    final String sql =
        "SELECT EXISTS (SELECT 1 FROM notifications WHERE notification_id = :notificationId)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public int incrementSendCount(UUID notificationId, int delta) {
    final String sql =
        """
        UPDATE notifications
        SET send_count = send_count + :delta
        WHERE notification_id = :notificationId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("delta", delta)
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  /** Only the publication flag and the expiry are editable after publish. */
  public int updatePublication(
      UUID notificationId, boolean published, Instant expiresAt, Instant updatedAt) {
    final String sql =
        """
        UPDATE notifications
        SET is_published = :published,
            expires_at = :expiresAt,
            updated_at = :updatedAt
        WHERE notification_id = :notificationId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("published", published)
            .addValue("expiresAt", toTimestamp(expiresAt), Types.TIMESTAMP)
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Locks notifications whose explicit expiry is at or before {@code now}. Rows locked by a
   * concurrent sweep are skipped. Must run inside a transaction.
   */
  public List<NotificationRecord> lockExpiryCandidates(Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE expires_at IS NOT NULL
              AND expires_at <= :now
            ORDER BY expires_at
            FOR UPDATE SKIP LOCKED
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteByIds(Collection<UUID> notificationIds) {
    if (notificationIds.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM notifications WHERE notification_id IN (:ids)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ids", notificationIds);
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getObject("notification_id", UUID.class),
        rs.getString("title"),
        rs.getString("body"),
        rs.getString("category"),
        NotificationPriority.valueOf(rs.getString("priority")),
        rs.getString("payload_json_text"),
        rs.getString("targeting_json_text"),
        rs.getBoolean("is_published"),
        toInstant(rs.getTimestamp("expires_at")),
        rs.getInt("send_count"),
        rs.getObject("created_by", UUID.class),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
