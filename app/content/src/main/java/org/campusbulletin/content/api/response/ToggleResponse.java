package org.campusbulletin.content.api.response;

/** Result of an idempotent add/remove; {@code changed} is false when nothing had to be done. */
public record ToggleResponse(boolean changed) {}
