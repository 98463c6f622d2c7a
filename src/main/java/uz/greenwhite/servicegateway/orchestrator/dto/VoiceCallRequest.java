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
public class VoiceCallRequest {

    @NotBlank(message = "Phone number is required")
    @Pattern(regexp = PhoneNumbers.E164, message = "Phone number must be in E.164 format")
    private String phoneNumber;

    /**
     * Falls back to gateway.backends.vapi.assistant-id
     */
    private String assistantId;

    private Map<String, Object> context;
}
