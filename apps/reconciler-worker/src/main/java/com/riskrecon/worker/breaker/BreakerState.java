package com.riskrecon.worker.breaker;

import java.time.Instant;

public record BreakerState(boolean engaged, String reason, String updatedBy, Instant updatedAt) {}
