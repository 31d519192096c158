/*
 * Where: content data access
 * What: RecipientDirectory backed by the users table
 * Why: Audience queries run against the latest snapshot of recipient attributes
 */
package org.campusbulletin.content.repository;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcRecipientDirectory implements RecipientDirectory {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Set<UUID> findAllIds() {
    final String sql = "SELECT user_id FROM users";
    return new HashSet<>(
        jdbcTemplate.queryForList(sql, new MapSqlParameterSource(), UUID.class));
  }

  @Override
  public Set<UUID> findIdsMatching(UUID branchId, Integer year, Integer semester) {
    // Only present filters are bound, so no untyped null parameter reaches the driver.
    final StringBuilder sql = new StringBuilder("SELECT user_id FROM users WHERE 1 = 1");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (branchId != null) {
      sql.append(" AND branch_id = :branchId");
      params.addValue("branchId", branchId);
    }
    if (year != null) {
      sql.append(" AND year_number = :year");
      params.addValue("year", year);
    }
    if (semester != null) {
      sql.append(" AND semester_number = :semester");
      params.addValue("semester", semester);
    }
    return new HashSet<>(jdbcTemplate.queryForList(sql.toString(), params, UUID.class));
  }

  @Override
  public Set<UUID> findExistingIds(Collection<UUID> candidateIds) {
    if (candidateIds.isEmpty()) {
      return Set.of();
    }
    final String sql = "SELECT user_id FROM users WHERE user_id IN (:ids)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", candidateIds);
    return new HashSet<>(jdbcTemplate.queryForList(sql, params, UUID.class));
  }

  @Override
  public boolean exists(UUID recipientId) {
    final String sql = "SELECT EXISTS (SELECT 1 FROM users WHERE user_id = :userId)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", recipientId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }
}
