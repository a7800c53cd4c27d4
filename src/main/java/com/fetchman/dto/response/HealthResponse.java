package com.fetchman.dto.response;

/**
 * @param status     {@code healthy} or {@code unhealthy}.
 * @param store      {@code available} or {@code unavailable}.
 * @param encryption {@code configured} or {@code not_configured}.
 * @param timestamp  ISO-8601 instant of the check.
 */
public record HealthResponse(String status, String store, String encryption, String timestamp) {
}
