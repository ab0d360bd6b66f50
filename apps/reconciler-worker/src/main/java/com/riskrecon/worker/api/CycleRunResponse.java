package com.riskrecon.worker.api;

public record CycleRunResponse(String outcome, long cycle) {}
