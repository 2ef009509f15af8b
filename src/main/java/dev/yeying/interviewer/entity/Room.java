package dev.yeying.interviewer.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Interview room as seen from the resume side: only its identity, owner and resume reference.
 * The row itself belongs to the room subsystem.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Room implements OwnedResource {

    private String id;

    private String name;

    private String ownerIdentity;

    private Long resumeId;

    private LocalDateTime updatedAt;

    @Override
    public String resourceDescriptor() {
        return "room " + id;
    }
}
