package org.campusbulletin.content.api.response;

import org.campusbulletin.content.model.MarkReadResult;

public record MarkReadResponse(MarkReadResult result) {}
