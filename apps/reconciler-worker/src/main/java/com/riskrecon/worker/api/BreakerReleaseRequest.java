package com.riskrecon.worker.api;

import jakarta.validation.constraints.Size;

public record BreakerReleaseRequest(@Size(max = 100) String actor) {}
