package dev.yeying.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeContentResponse {

    private String resumeId;
    private String fullName;
    private String email;
    private String phone;
    private String location;
    private String website;
    private String summary;

    @Builder.Default
    private List<EducationEntry> education = new ArrayList<>();

    @Builder.Default
    private List<ExperienceEntry> experience = new ArrayList<>();

    @Builder.Default
    private List<ProjectEntry> projects = new ArrayList<>();

    @Builder.Default
    private List<SkillEntry> skills = new ArrayList<>();

    @Builder.Default
    private List<CertificationEntry> certifications = new ArrayList<>();

    private LocalDateTime updatedAt;

    /**
     * Content of a node that has no content record yet.
     */
    public static ResumeContentResponse empty(Long resumeId) {
        return ResumeContentResponse.builder()
                .resumeId(String.valueOf(resumeId))
                .build();
    }
}
