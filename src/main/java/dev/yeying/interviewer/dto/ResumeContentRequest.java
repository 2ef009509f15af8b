package dev.yeying.interviewer.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial content update. A {@code null} field is left untouched; an empty list clears the section.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Fields to change on a resume's content; omitted fields keep their value")
public class ResumeContentRequest {

    @Size(max = 100)
    private String fullName;

    @Email(message = "Email must be a valid address")
    @Size(max = 200)
    private String email;

    @Size(max = 50)
    private String phone;

    @Size(max = 200)
    private String location;

    @Size(max = 500)
    private String website;

    @Size(max = 5000)
    private String summary;

    @Valid
    private List<@NotNull(message = "Education entries must not be null") EducationEntry> education;

    @Valid
    private List<@NotNull(message = "Experience entries must not be null") ExperienceEntry> experience;

    @Valid
    private List<@NotNull(message = "Project entries must not be null") ProjectEntry> projects;

    @Valid
    private List<@NotNull(message = "Skill entries must not be null") SkillEntry> skills;

    @Valid
    private List<@NotNull(message = "Certification entries must not be null") CertificationEntry> certifications;
}
