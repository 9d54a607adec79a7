package dev.reviewflow.dto.response;

import java.time.Instant;

public record EscalationResponse(int escalated, Instant sweptAt) {}
