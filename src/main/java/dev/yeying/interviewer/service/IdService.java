package dev.yeying.interviewer.service;

import dev.yeying.interviewer.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Issues identifiers for new resume nodes and content records.
 *
 * <pre>
 * ResumeNode node = ResumeNode.builder()
 *     .id(idService.nextId())
 *     .name("Backend Engineer")
 *     .build();
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }

    /**
     * Instant at which the given identifier was issued.
     */
    public Instant issuedAt(long id) {
        return SnowflakeId.issuedAt(id);
    }
}
