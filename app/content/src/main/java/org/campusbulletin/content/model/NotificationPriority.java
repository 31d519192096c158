package org.campusbulletin.content.model;

public enum NotificationPriority {
  LOW,
  NORMAL,
  HIGH,
  URGENT
}
