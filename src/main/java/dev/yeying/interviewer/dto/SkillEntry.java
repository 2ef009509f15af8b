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
@Schema(description = "A named group of skills")
public class SkillEntry {

    @NotBlank(message = "Skill category is required")
    @Size(max = 100)
    private String category;

    @Builder.Default
    private List<@NotNull @Size(max = 100) String> items = new ArrayList<>();
}
