/*
 * Where: content domain model
 * What: Snapshot of an opportunities row
 * Why: The deadline doubles as the expiry of the opportunity
 */
package org.campusbulletin.content.model;

import java.time.Instant;
import java.util.UUID;

public record OpportunityRecord(
    UUID opportunityId,
    String title,
    String opportunityType,
    String organization,
    String description,
    String location,
    String applicationReference,
    Instant deadline,
    boolean published,
    UUID createdBy,
    Instant createdAt,
    Instant updatedAt) {}
