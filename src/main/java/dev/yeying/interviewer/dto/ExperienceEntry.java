package dev.yeying.interviewer.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One work experience record")
public class ExperienceEntry {

    @NotBlank(message = "Company is required")
    @Size(max = 200)
    private String company;

    @Size(max = 200)
    private String title;

    @Size(max = 20)
    private String start;

    @Size(max = 20)
    private String end;

    @Builder.Default
    private List<@NotNull @Size(max = 1000) String> highlights = new ArrayList<>();
}
