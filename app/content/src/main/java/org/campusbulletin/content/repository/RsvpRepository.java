package org.campusbulletin.content.repository;

import static org.campusbulletin.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RsvpRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean insertIfAbsent(UUID eventId, UUID userId, Instant createdAt) {
    final String sql =
        """
        INSERT INTO event_rsvps (event_id, user_id, created_at)
        VALUES (:eventId, :userId, :createdAt)
        ON CONFLICT (event_id, user_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("userId", userId)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public boolean delete(UUID eventId, UUID userId) {
    final String sql = "DELETE FROM event_rsvps WHERE event_id = :eventId AND user_id = :userId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("eventId", eventId).addValue("userId", userId);
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int countByEvent(UUID eventId) {
    final String sql = "SELECT COUNT(*) FROM event_rsvps WHERE event_id = :eventId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteByEventIds(Collection<UUID> eventIds) {
    if (eventIds.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM event_rsvps WHERE event_id IN (:ids)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", eventIds);
    return jdbcTemplate.update(sql, params);
  }
}
