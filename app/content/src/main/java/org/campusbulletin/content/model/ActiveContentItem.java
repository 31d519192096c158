/*
 * Where: content domain model
 * What: Read-time projection shared by events and opportunities
 * Why: The unified feed merges both kinds without a common base table
 */
package org.campusbulletin.content.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One entry of the active-content feed.
 *
 * <p>{@code effectiveAt} is the start of the event day for events and the deadline for
 * opportunities. {@code effectiveDate} is the calendar day of that instant in the expiration zone
 * and is what the feed orders on. {@code expiresAt} is the instant the item stops being live, or
 * {@code null} when it never expires.
 */
public record ActiveContentItem(
    UUID id,
    ContentKind kind,
    String title,
    String description,
    Instant effectiveAt,
    LocalDate effectiveDate,
    String location,
    Instant expiresAt,
    boolean published,
    Instant createdAt) {}
