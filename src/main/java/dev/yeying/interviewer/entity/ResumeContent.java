package dev.yeying.interviewer.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Structured body of a resume node, at most one per node.
 * List sections are JSON arrays held in text columns; {@code null} means the section was never set.
 */
@Table("resume_contents")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResumeContent implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("resume_id")
    private Long resumeId;

    @Column("full_name")
    private String fullName;

    private String email;

    private String phone;

    private String location;

    private String website;

    private String summary;

    private String education;

    private String experience;

    private String projects;

    private String skills;

    private String certifications;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
