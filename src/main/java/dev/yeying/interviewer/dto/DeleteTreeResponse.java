package dev.yeying.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeleteTreeResponse {

    /** Number of versions marked deleted, the target included. */
    private long deleted;
}
