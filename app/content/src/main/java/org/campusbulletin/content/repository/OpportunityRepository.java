/*
 * Where: content data access
 * What: opportunities rows for authoring, live reads, bookmarks and cleanup
 * Why: The deadline is the only expiry input for opportunities
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
import org.campusbulletin.content.model.OpportunityRecord;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OpportunityRepository {

  private static final String COLUMNS =
      """
      o.opportunity_id, o.title, o.opportunity_type, o.organization, o.description, o.location,
      o.application_reference, o.deadline, o.is_published, o.created_by, o.created_at, o.updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(OpportunityRecord record) {
    final String sql =
        """
        INSERT INTO opportunities (
          opportunity_id, title, opportunity_type, organization, description, location,
          application_reference, deadline, is_published, created_by, created_at, updated_at
        ) VALUES (
          :opportunityId, :title, :opportunityType, :organization, :description, :location,
          :applicationReference, :deadline, :published, :createdBy, :createdAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("opportunityId", record.opportunityId())
            .addValue("title", record.title())
            .addValue("opportunityType", record.opportunityType())
            .addValue("organization", record.organization())
            .addValue("description", record.description())
            .addValue("location", record.location(), Types.VARCHAR)
            .addValue("applicationReference", record.applicationReference(), Types.VARCHAR)
            .addValue("deadline", toTimestamp(record.deadline()), Types.TIMESTAMP)
            .addValue("published", record.published())
            .addValue("createdBy", record.createdBy(), Types.OTHER)
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
    return record.opportunityId();
  }

  public Optional<OpportunityRecord> findById(UUID opportunityId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM opportunities o WHERE o.opportunity_id = :opportunityId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("opportunityId", opportunityId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean exists(UUID opportunityId) {
    final String sql =
        "SELECT EXISTS (SELECT 1 FROM opportunities WHERE opportunity_id = :opportunityId)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("opportunityId", opportunityId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public List<OpportunityRecord> findPublishedCandidates(Instant now) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM opportunities o
            WHERE o.is_published = TRUE
              AND (o.deadline IS NULL OR o.deadline > :now)
            ORDER BY o.deadline NULLS LAST, o.created_at DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Published opportunities bookmarked by the user, most recently bookmarked first. */
  public List<OpportunityRecord> findPublishedBookmarkedBy(UUID userId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM opportunity_bookmarks b
            JOIN opportunities o ON o.opportunity_id = b.opportunity_id
            WHERE b.user_id = :userId
              AND o.is_published = TRUE
            ORDER BY b.created_at DESC, o.opportunity_id
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int updatePublication(
      UUID opportunityId, boolean published, Instant deadline, Instant updatedAt) {
    final String sql =
        """
        UPDATE opportunities
        SET is_published = :published,
            deadline = :deadline,
            updated_at = :updatedAt
        WHERE opportunity_id = :opportunityId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("published", published)
            .addValue("deadline", toTimestamp(deadline), Types.TIMESTAMP)
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("opportunityId", opportunityId);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Locks opportunities whose deadline is at or before {@code now}, skipping rows held by a
   * concurrent sweep. Must run inside a transaction.
   */
  public List<OpportunityRecord> lockExpiryCandidates(Instant now) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM opportunities o
            WHERE o.deadline IS NOT NULL
              AND o.deadline <= :now
            ORDER BY o.deadline
            FOR UPDATE SKIP LOCKED
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteByIds(Collection<UUID> opportunityIds) {
    if (opportunityIds.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM opportunities WHERE opportunity_id IN (:ids)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", opportunityIds);
    return jdbcTemplate.update(sql, params);
  }

  private OpportunityRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OpportunityRecord(
        rs.getObject("opportunity_id", UUID.class),
        rs.getString("title"),
        rs.getString("opportunity_type"),
        rs.getString("organization"),
        rs.getString("description"),
        rs.getString("location"),
        rs.getString("application_reference"),
        toInstant(rs.getTimestamp("deadline")),
        rs.getBoolean("is_published"),
        rs.getObject("created_by", UUID.class),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
