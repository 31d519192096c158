/*
 * Where: content domain model
 * What: Levels of the branch -> year -> semester activation hierarchy
 * Why: Maps URL path segments to the backing table and id column
 */
package org.campusbulletin.content.model;

import java.util.Locale;

public enum TaxonomyKind {
  BRANCH("branches", "branch_id"),
  YEAR("branch_years", "year_id"),
  SEMESTER("branch_semesters", "semester_id");

  private final String table;
  private final String idColumn;

  TaxonomyKind(String table, String idColumn) {
    this.table = table;
    this.idColumn = idColumn;
  }

  public String table() {
    return table;
  }

  public String idColumn() {
    return idColumn;
  }

  public static TaxonomyKind parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("taxonomy kind is required");
    }
    try {
      return TaxonomyKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("taxonomy kind must be one of branch, year, semester", ex);
    }
  }
}
