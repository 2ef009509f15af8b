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
 * One version of a resume. Roots have no parent and carry their own id as {@code rootId};
 * every fork sits one level below its parent and shares the parent's root.
 */
@Table("resume_nodes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeNode implements Persistable<Long>, NewRecordAware, OwnedResource {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("parent_id")
    private Long parentId;

    @Column("root_id")
    private Long rootId;

    /**
     * 0 for roots, parent depth + 1 otherwise. Never above 4.
     */
    private Integer depth;

    private String name;

    @Column("owner_identity")
    private String ownerIdentity;

    /**
     * One of {@link ResumeNodeStatus} values.
     */
    @Builder.Default
    private String status = ResumeNodeStatus.DRAFT.value();

    @Column("target_company")
    private String targetCompany;

    @Column("target_position")
    private String targetPosition;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isDeleted() {
        return ResumeNodeStatus.DELETED.matches(status);
    }

    @Override
    public String resourceDescriptor() {
        return "resume " + id;
    }
}
