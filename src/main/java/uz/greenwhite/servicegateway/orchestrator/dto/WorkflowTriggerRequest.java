package uz.greenwhite.servicegateway.orchestrator.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowTriggerRequest {

    @NotBlank(message = "Event is required")
    @Pattern(regexp = "^[a-zA-Z0-9_-]+$", message = "Event may contain letters, digits, '_' and '-' only")
    private String event;

    private Map<String, Object> data;
}
