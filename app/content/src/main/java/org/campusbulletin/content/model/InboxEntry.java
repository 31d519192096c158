package org.campusbulletin.content.model;

/** A delivery joined with the notification it points at. */
public record InboxEntry(NotificationRecord notification, DeliveryRecord delivery) {}
