package org.campusbulletin.content.model;

import java.util.UUID;

/**
 * An active taxonomy row. {@code parentId} is null for branches; {@code number} is the year or
 * semester number and null for branches.
 */
public record TaxonomyEntry(
    TaxonomyKind kind, UUID id, UUID parentId, String name, Integer number, int displayOrder) {}
