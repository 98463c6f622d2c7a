package uz.greenwhite.servicegateway.ratelimit;

import java.util.List;

public record RateLimiterStats(int totalEntries,
                               int activeClients,
                               List<EndpointUsage> topEndpoints) {

    public record EndpointUsage(String endpoint, long requests) {
    }
}
