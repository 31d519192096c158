package org.campusbulletin.content.model;

import java.util.UUID;

/** Outcome of one fan-out run; {@code deliveredCount} counts rows created by this run only. */
public record DeliveryResult(UUID notificationId, int deliveredCount) {}
