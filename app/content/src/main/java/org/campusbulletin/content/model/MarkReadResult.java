package org.campusbulletin.content.model;

public enum MarkReadResult {
  MARKED,
  ALREADY_READ
}
