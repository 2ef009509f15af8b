package dev.yeying.interviewer.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One certification record")
public class CertificationEntry {

    @NotBlank(message = "Certification name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 200)
    private String issuer;

    @Size(max = 20)
    private String date;
}
