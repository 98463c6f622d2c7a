package uz.greenwhite.servicegateway.orchestrator.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SmsRequest {

    @NotBlank(message = "Recipient is required")
    @Pattern(regexp = PhoneNumbers.E164, message = "Recipient must be in E.164 format")
    private String to;

    @NotBlank(message = "Message is required")
    @Size(min = 1, max = 1600, message = "Message must be between 1 and 1600 characters")
    private String message;

    @Pattern(regexp = "^(low|normal|high)$", message = "Priority must be low, normal or high")
    private String priority;
}
