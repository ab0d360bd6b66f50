package com.riskrecon.worker.api;

import jakarta.validation.constraints.Size;

public record BreakerEngageRequest(@Size(max = 200) String reason, @Size(max = 100) String actor) {}
