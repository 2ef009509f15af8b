package dev.yeying.interviewer.dto;

import dev.yeying.interviewer.entity.ResumeNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeNodeResponse {

    private String id;
    private String parentId;
    private String rootId;
    private Integer depth;
    private String name;
    private String status;
    private String targetCompany;
    private String targetPosition;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ResumeNodeResponse fromEntity(ResumeNode node) {
        return ResumeNodeResponse.builder()
                .id(String.valueOf(node.getId()))
                .parentId(node.getParentId() != null ? String.valueOf(node.getParentId()) : null)
                .rootId(String.valueOf(node.getRootId()))
                .depth(node.getDepth())
                .name(node.getName())
                .status(node.getStatus())
                .targetCompany(node.getTargetCompany())
                .targetPosition(node.getTargetPosition())
                .createdAt(node.getCreatedAt())
                .updatedAt(node.getUpdatedAt())
                .build();
    }
}
