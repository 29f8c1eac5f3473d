package com.flowmetrics.service.core.query;

import java.time.Instant;
import java.util.Map;

/** Latest reported value per metric kind for one swarm. {@code lastUpdated} is null when nothing was reported. */
public record SwarmHealth(String swarmId, Map<String, Double> latestValues, Instant lastUpdated) {}
