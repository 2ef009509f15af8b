package dev.yeying.interviewer.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Counts over the caller's non-deleted resume versions")
public class ResumeTreeStats {

    @Schema(description = "Draft plus published versions")
    private long total;

    private long published;

    private long draft;

    @Schema(description = "Rooms currently referencing one of the caller's versions")
    private long linkedRooms;
}
