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
@Schema(description = "One education record")
public class EducationEntry {

    @NotBlank(message = "School is required")
    @Size(max = 200)
    private String school;

    @Size(max = 100)
    private String degree;

    @Size(max = 200)
    private String major;

    @Schema(example = "2018-09")
    @Size(max = 20)
    private String start;

    @Schema(example = "2022-06")
    @Size(max = 20)
    private String end;
}
