package org.campusbulletin.content.model;

public enum TargetingMode {
  ALL_USERS,
  FILTERED,
  EXPLICIT
}
