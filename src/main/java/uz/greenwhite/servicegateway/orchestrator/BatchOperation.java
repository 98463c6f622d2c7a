package uz.greenwhite.servicegateway.orchestrator;

import java.util.Map;

public record BatchOperation(String service,
                             String operation,
                             Map<String, Object> params,
                             OrchestrationContext context) {
}
