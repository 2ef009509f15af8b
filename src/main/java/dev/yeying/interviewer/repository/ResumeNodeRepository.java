package dev.yeying.interviewer.repository;

import dev.yeying.interviewer.entity.ResumeNode;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface ResumeNodeRepository extends R2dbcRepository<ResumeNode, Long> {

    @Query("SELECT * FROM resume_nodes WHERE id = :id AND status <> 'deleted'")
    Mono<ResumeNode> findActiveById(Long id);

    /**
     * Same as {@link #findActiveById(Long)} but holds a row lock until the surrounding transaction ends.
     */
    @Query("SELECT * FROM resume_nodes WHERE id = :id AND status <> 'deleted' FOR UPDATE")
    Mono<ResumeNode> findActiveByIdForUpdate(Long id);

    @Query("SELECT id FROM resume_nodes WHERE parent_id = :parentId AND status <> 'deleted' FOR UPDATE")
    Flux<Long> findActiveChildIdsForUpdate(Long parentId);

    @Query("SELECT * FROM resume_nodes WHERE owner_identity = :ownerIdentity AND status <> 'deleted' " +
           "ORDER BY created_at ASC, id ASC")
    Flux<ResumeNode> findActiveByOwner(String ownerIdentity);

    @Query("SELECT * FROM resume_nodes WHERE owner_identity = :ownerIdentity AND status = 'published' " +
           "ORDER BY updated_at DESC, id DESC")
    Flux<ResumeNode> findPublishedByOwner(String ownerIdentity);

    @Query("SELECT id FROM resume_nodes WHERE owner_identity = :ownerIdentity AND name = :name AND status <> 'deleted'")
    Flux<Long> findActiveIdsByOwnerAndName(String ownerIdentity, String name);

    @Query("SELECT COUNT(*) FROM resume_nodes WHERE owner_identity = :ownerIdentity AND status = :status")
    Mono<Long> countByOwnerAndStatus(String ownerIdentity, String status);

    @Modifying
    @Query("UPDATE resume_nodes SET status = 'deleted', updated_at = :updatedAt " +
           "WHERE id IN (:ids) AND status <> 'deleted'")
    Mono<Long> markDeleted(Collection<Long> ids, LocalDateTime updatedAt);
}
