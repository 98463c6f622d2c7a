package uz.greenwhite.servicegateway.orchestrator;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class BatchOptions {

    @Builder.Default
    int maxConcurrency = 5;

    @Builder.Default
    boolean failFast = false;

    /**
     * Per operation, not for the whole batch
     */
    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);
}
