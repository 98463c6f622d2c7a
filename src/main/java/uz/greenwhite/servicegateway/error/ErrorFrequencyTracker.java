package uz.greenwhite.servicegateway.error;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hourly error counters per {@code source:code}. Warns when a key passes the
 * pattern threshold; never blocks anything.
 */
@Slf4j
public class ErrorFrequencyTracker {

    private static final long WINDOW_MS = Duration.ofHours(1).toMillis();
    private static final int TOP_LIMIT = 10;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final int patternThreshold;
    private final Clock clock;

    public ErrorFrequencyTracker(int patternThreshold, Clock clock) {
        this.patternThreshold = patternThreshold;
        this.clock = clock;
    }

    /**
     * @return the count for this key within the current hour
     */
    public long track(StandardError error) {
        String key = keyOf(error);
        long now = clock.millis();
        Counter counter = counters.computeIfAbsent(key, k -> new Counter(error.getCategory(), error.getSource()));
        long count = counter.increment(now);

        if (count == patternThreshold + 1) {
            log.warn("Error pattern detected [{}]: {} occurrences within the last hour", key, count);
        }
        return count;
    }

    public ErrorStats getErrorStats() {
        long now = clock.millis();
        Map<ErrorCategory, Long> byCategory = new EnumMap<>(ErrorCategory.class);
        Map<String, Long> bySource = new TreeMap<>();
        long total = 0;

        for (Counter counter : counters.values()) {
            long count = counter.current(now);
            if (count == 0) continue;
            total += count;
            byCategory.merge(counter.category, count, Long::sum);
            bySource.merge(counter.source, count, Long::sum);
        }

        List<ErrorStats.ErrorCount> top = counters.entrySet().stream()
                .map(e -> new ErrorStats.ErrorCount(e.getKey(), e.getValue().current(now)))
                .filter(c -> c.count() > 0)
                .sorted(Comparator.comparingLong(ErrorStats.ErrorCount::count).reversed()
                        .thenComparing(ErrorStats.ErrorCount::key))
                .limit(TOP_LIMIT)
                .toList();

        return new ErrorStats(total, byCategory, bySource, top);
    }

    /**
     * Drops counters whose hour has passed.
     */
    public int sweepExpired() {
        long now = clock.millis();
        int before = counters.size();
        counters.values().removeIf(c -> c.current(now) == 0);
        return before - counters.size();
    }

    public void clear() {
        counters.clear();
    }

    private static String keyOf(StandardError error) {
        String source = error.getSource() == null ? "unknown" : error.getSource();
        return source + ":" + error.getCode();
    }

    private static final class Counter {
        private final ErrorCategory category;
        private final String source;
        private long windowStart = -1;
        private long count;

        private Counter(ErrorCategory category, String source) {
            this.category = category;
            this.source = source == null ? "unknown" : source;
        }

        synchronized long increment(long now) {
            if (windowStart < 0 || now - windowStart >= WINDOW_MS) {
                windowStart = now;
                count = 0;
            }
            return ++count;
        }

        synchronized long current(long now) {
            if (windowStart < 0 || now - windowStart >= WINDOW_MS) {
                return 0;
            }
            return count;
        }
    }
}
