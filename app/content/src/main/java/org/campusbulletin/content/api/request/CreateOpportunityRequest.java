package org.campusbulletin.content.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateOpportunityRequest(
    @NotBlank @Size(max = 200) String title,
    @NotBlank @Size(max = 64) String opportunityType,
    @NotBlank @Size(max = 200) String organization,
    @NotBlank @Size(max = 5000) String description,
    @Size(max = 200) String location,
    @Size(max = 1000) String applicationReference,
    Instant deadline,
    Boolean published,
    UUID createdBy) {}
