package uz.greenwhite.servicegateway.orchestrator;

import java.util.Map;

/**
 * @param services configured state per service id
 */
public record OrchestratorStats(Map<String, Boolean> services,
                                int cacheSize,
                                long cacheHits,
                                long cacheMisses,
                                double hitRate,
                                long totalOperations) {
}
