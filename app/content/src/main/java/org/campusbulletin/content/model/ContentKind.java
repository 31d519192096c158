package org.campusbulletin.content.model;

public enum ContentKind {
  NOTIFICATION,
  EVENT,
  OPPORTUNITY
}
