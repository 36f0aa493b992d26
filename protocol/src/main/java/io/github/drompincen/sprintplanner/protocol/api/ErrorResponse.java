package io.github.drompincen.sprintplanner.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        ErrorKind kind,
        String error,
        String message,
        String remediation,
        Map<String, Object> details,
        Instant timestamp
) {}
