/*
 * Where: content data access
 * What: Per-recipient delivery rows and their read state
 * Why: Idempotency lives in SQL (ON CONFLICT, guarded UPDATE) rather than check-then-act code
 */
package org.campusbulletin.content.repository;

import static org.campusbulletin.common.JdbcTimestampUtils.toInstant;
import static org.campusbulletin.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.model.DeliveryRecord;
import org.campusbulletin.content.model.InboxEntry;
import org.campusbulletin.content.model.NotificationPriority;
import org.campusbulletin.content.model.NotificationRecord;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Creates the delivery row unless one already exists for the pair.
   *
   * @return {@code true} when a row was inserted, {@code false} when it already existed
   */
  public boolean insertIfAbsent(UUID notificationId, UUID recipientId, Instant createdAt) {
    final String sql =
        """
        INSERT INTO notification_deliveries (notification_id, recipient_id, is_read, read_at, created_at)
        VALUES (:notificationId, :recipientId, FALSE, NULL, :createdAt)
        ON CONFLICT (notification_id, recipient_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("recipientId", recipientId)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  /** Flips the row to read only if it is still unread; returns the number of rows changed. */
  public int markRead(UUID notificationId, UUID recipientId, Instant readAt) {
    final String sql =
        """
        UPDATE notification_deliveries
        SET is_read = TRUE,
            read_at = :readAt
        WHERE notification_id = :notificationId
          AND recipient_id = :recipientId
          AND is_read = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("readAt", toTimestamp(readAt))
            .addValue("notificationId", notificationId)
            .addValue("recipientId", recipientId);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Marks every unread delivery of the recipient whose notification is live at {@code now}, in one
   * statement. The live condition matches {@code ExpirationPolicy.isLive} for notifications.
   */
  public int markAllLiveRead(UUID recipientId, Instant now) {
    final String sql =
        """
        UPDATE notification_deliveries d
        SET is_read = TRUE,
            read_at = :now
        FROM notifications n
        WHERE n.notification_id = d.notification_id
          AND d.recipient_id = :recipientId
          AND d.is_read = FALSE
          AND n.is_published = TRUE
          AND (n.expires_at IS NULL OR n.expires_at > :now)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("recipientId", recipientId);
    return jdbcTemplate.update(sql, params);
  }

  public boolean exists(UUID notificationId, UUID recipientId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM notification_deliveries
          WHERE notification_id = :notificationId
            AND recipient_id = :recipientId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("recipientId", recipientId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public int countUnreadLive(UUID recipientId, Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_deliveries d
        JOIN notifications n ON n.notification_id = d.notification_id
        WHERE d.recipient_id = :recipientId
          AND d.is_read = FALSE
          AND n.is_published = TRUE
          AND (n.expires_at IS NULL OR n.expires_at > :now)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /** One page of unread deliveries whose notification is live at {@code now}, newest first. */
  public List<InboxEntry> findUnreadLive(UUID recipientId, Instant now, int limit, int offset) {
    final String sql =
        """
        SELECT n.notification_id, n.title, n.body, n.category, n.priority,
               n.payload_json::text AS payload_json_text, n.targeting_json::text AS targeting_json_text,
               n.is_published, n.expires_at, n.send_count, n.created_by,
               n.created_at AS notification_created_at, n.updated_at,
               d.recipient_id, d.is_read, d.read_at, d.created_at AS delivery_created_at
        FROM notification_deliveries d
        JOIN notifications n ON n.notification_id = d.notification_id
        WHERE d.recipient_id = :recipientId
          AND d.is_read = FALSE
          AND n.is_published = TRUE
          AND (n.expires_at IS NULL OR n.expires_at > :now)
        ORDER BY n.created_at DESC, n.notification_id
        LIMIT :limit OFFSET :offset
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("now", toTimestamp(now))
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapInboxRow);
  }

  public int countByNotification(UUID notificationId) {
    final String sql =
        "SELECT COUNT(*) FROM notification_deliveries WHERE notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteByNotificationIds(Collection<UUID> notificationIds) {
    if (notificationIds.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM notification_deliveries WHERE notification_id IN (:ids)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ids", notificationIds);
    return jdbcTemplate.update(sql, params);
  }

  private InboxEntry mapInboxRow(ResultSet rs, int rowNum) throws SQLException {
    final UUID notificationId = rs.getObject("notification_id", UUID.class);
    final NotificationRecord notification =
        new NotificationRecord(
            notificationId,
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
            toInstant(rs.getTimestamp("notification_created_at")),
            toInstant(rs.getTimestamp("updated_at")));
    final DeliveryRecord delivery =
        new DeliveryRecord(
            notificationId,
            rs.getObject("recipient_id", UUID.class),
            rs.getBoolean("is_read"),
            toInstant(rs.getTimestamp("read_at")),
            toInstant(rs.getTimestamp("delivery_created_at")));
    return new InboxEntry(notification, delivery);
  }
}
