/*
 * Where: content data access
 * What: Activation flags of the branch -> year -> semester taxonomy
 * Why: Active sets are gated by every ancestor, not by the row's own flag alone
 */
package org.campusbulletin.content.repository;

import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.model.TaxonomyEntry;
import org.campusbulletin.content.model.TaxonomyKind;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TaxonomyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int setActive(TaxonomyKind kind, UUID id, boolean active) {
    // Table and column come from the enum, never from request input.
    final String sql =
        "UPDATE " + kind.table() + " SET is_active = :active WHERE " + kind.idColumn() + " = :id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("active", active).addValue("id", id);
    return jdbcTemplate.update(sql, params);
  }

  public List<TaxonomyEntry> findActive(TaxonomyKind kind) {
    return switch (kind) {
      case BRANCH -> findActiveBranches();
      case YEAR -> findActiveYears();
      case SEMESTER -> findActiveSemesters();
    };
  }

  private List<TaxonomyEntry> findActiveBranches() {
    final String sql =
        """
        SELECT branch_id, name, display_order
        FROM branches
        WHERE is_active = TRUE
        ORDER BY display_order, name
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new TaxonomyEntry(
                TaxonomyKind.BRANCH,
                rs.getObject("branch_id", UUID.class),
                null,
                rs.getString("name"),
                null,
                rs.getInt("display_order")));
  }

  private List<TaxonomyEntry> findActiveYears() {
    final String sql =
        """
        SELECT y.year_id, y.branch_id, b.name, y.year_number, y.display_order
        FROM branch_years y
        JOIN branches b ON b.branch_id = y.branch_id
        WHERE y.is_active = TRUE
          AND b.is_active = TRUE
        ORDER BY b.display_order, y.display_order, y.year_number
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new TaxonomyEntry(
                TaxonomyKind.YEAR,
                rs.getObject("year_id", UUID.class),
                rs.getObject("branch_id", UUID.class),
                rs.getString("name"),
                rs.getInt("year_number"),
                rs.getInt("display_order")));
  }

  private List<TaxonomyEntry> findActiveSemesters() {
    final String sql =
        """
        SELECT s.semester_id, s.year_id, b.name, s.semester_number, s.display_order
        FROM branch_semesters s
        JOIN branch_years y ON y.year_id = s.year_id
        JOIN branches b ON b.branch_id = y.branch_id
        WHERE s.is_active = TRUE
          AND y.is_active = TRUE
          AND b.is_active = TRUE
        ORDER BY b.display_order, y.display_order, s.display_order, s.semester_number
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new TaxonomyEntry(
                TaxonomyKind.SEMESTER,
                rs.getObject("semester_id", UUID.class),
                rs.getObject("year_id", UUID.class),
                rs.getString("name"),
                rs.getInt("semester_number"),
                rs.getInt("display_order")));
  }
}
