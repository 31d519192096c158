package org.campusbulletin.content.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateEventRequest(
    @NotBlank @Size(max = 200) String title,
    @NotBlank @Size(max = 5000) String description,
    @NotNull LocalDate eventDate,
    LocalTime startTime,
    LocalTime endTime,
    @Size(max = 200) String location,
    @Size(max = 200) String organizer,
    Instant registrationDeadline,
    Instant expiresAt,
    Boolean published,
    UUID createdBy) {}
