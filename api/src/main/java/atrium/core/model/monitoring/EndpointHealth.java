package atrium.core.model.monitoring;

/**
 * Live statistics for one endpoint in the current health window.
 */
public record EndpointHealth(
        String endpoint, long totalRequests, long failedRequests, double averageResponseTime, long p95ResponseTime) {

    public double errorRate() {
        return totalRequests == 0 ? 0.0 : (double) failedRequests / totalRequests;
    }
}
