package uz.greenwhite.servicegateway.error;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uz.greenwhite.servicegateway.support.MutableClock;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorFrequencyTrackerTest {

    private MutableClock clock;
    private ErrorFrequencyTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tracker = new ErrorFrequencyTracker(3, clock);
    }

    @Test
    @DisplayName("counts per source and code within the hour")
    void countsPerKey() {
        assertThat(tracker.track(error("vapi", "HTTP_503", ErrorCategory.SERVER_ERROR))).isEqualTo(1);
        assertThat(tracker.track(error("vapi", "HTTP_503", ErrorCategory.SERVER_ERROR))).isEqualTo(2);
        assertThat(tracker.track(error("twilio", "HTTP_503", ErrorCategory.SERVER_ERROR))).isEqualTo(1);

        ErrorStats stats = tracker.getErrorStats();
        assertThat(stats.totalErrors()).isEqualTo(3);
        assertThat(stats.errorsByCategory()).containsEntry(ErrorCategory.SERVER_ERROR, 3L);
        assertThat(stats.topErrors()).first().isEqualTo(new ErrorStats.ErrorCount("vapi:HTTP_503", 2));
    }

    @Test
    @DisplayName("counters restart after an hour and are swept once stale")
    void hourlyWindow() {
        tracker.track(error("n8n", "TIMEOUT", ErrorCategory.TIMEOUT_ERROR));
        tracker.track(error("n8n", "TIMEOUT", ErrorCategory.TIMEOUT_ERROR));

        clock.advance(Duration.ofMinutes(61));

        assertThat(tracker.getErrorStats().totalErrors()).isZero();
        assertThat(tracker.sweepExpired()).isEqualTo(1);
        assertThat(tracker.track(error("n8n", "TIMEOUT", ErrorCategory.TIMEOUT_ERROR))).isEqualTo(1);
    }

    @Test
    @DisplayName("errors without a source are grouped under unknown")
    void unknownSource() {
        tracker.track(error(null, "X", ErrorCategory.CLIENT_ERROR));

        assertThat(tracker.getErrorStats().errorsBySource()).containsEntry("unknown", 1L);
    }

    private static StandardError error(String source, String code, ErrorCategory category) {
        return StandardError.builder()
                .source(source)
                .code(code)
                .category(category)
                .severity(category.getBaseSeverity())
                .build();
    }
}
