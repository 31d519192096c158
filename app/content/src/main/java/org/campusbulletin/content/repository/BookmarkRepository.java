/*
 * Where: content data access
 * What: User-to-opportunity bookmarks
 * Why: Add and remove are idempotent at the SQL level
 */
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
public class BookmarkRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean insertIfAbsent(UUID opportunityId, UUID userId, Instant createdAt) {
    final String sql =
        """
        INSERT INTO opportunity_bookmarks (opportunity_id, user_id, created_at)
        VALUES (:opportunityId, :userId, :createdAt)
        ON CONFLICT (opportunity_id, user_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("opportunityId", opportunityId)
            .addValue("userId", userId)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public boolean delete(UUID opportunityId, UUID userId) {
    final String sql =
        """
        DELETE FROM opportunity_bookmarks
        WHERE opportunity_id = :opportunityId
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("opportunityId", opportunityId)
            .addValue("userId", userId);
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int deleteByOpportunityIds(Collection<UUID> opportunityIds) {
    if (opportunityIds.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM opportunity_bookmarks WHERE opportunity_id IN (:ids)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", opportunityIds);
    return jdbcTemplate.update(sql, params);
  }
}
