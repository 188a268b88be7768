package org.causalcalc.model.dto;

/** Reply of {@code GET /health}. */
public record HealthReply(boolean healthy, String serverName, long uptimeSeconds, int requestCount) {
}
