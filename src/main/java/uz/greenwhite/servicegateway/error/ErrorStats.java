package uz.greenwhite.servicegateway.error;

import java.util.List;
import java.util.Map;

public record ErrorStats(
        long totalErrors,
        Map<ErrorCategory, Long> errorsByCategory,
        Map<String, Long> errorsBySource,
        List<ErrorCount> topErrors
) {

    public record ErrorCount(String key, long count) {
    }
}
