package dev.yeying.interviewer.dto;

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
public class ResumeNodeDetailResponse {

    private ResumeNodeResponse node;
    private ResumeContentResponse content;

    @Builder.Default
    private List<LinkedRoom> linkedRooms = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LinkedRoom {
        private String id;
        private String name;
    }
}
