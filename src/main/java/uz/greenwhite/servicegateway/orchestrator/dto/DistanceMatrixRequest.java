package uz.greenwhite.servicegateway.orchestrator.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistanceMatrixRequest {

    @NotEmpty(message = "At least one origin is required")
    @Size(max = 25, message = "At most 25 origins are allowed")
    private List<@NotBlank String> origins;

    @NotEmpty(message = "At least one destination is required")
    @Size(max = 25, message = "At most 25 destinations are allowed")
    private List<@NotBlank String> destinations;
}
