package dev.yeying.interviewer.service;

import dev.yeying.interviewer.entity.ResumeNode;
import dev.yeying.interviewer.entity.ResumeNodeStatus;
import dev.yeying.interviewer.exception.StorageFailureException;
import dev.yeying.interviewer.repository.ResumeNodeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Persistence of resume versions. Every database error leaves this class as a {@link StorageFailureException}.
 *
 * <p>Lookups ignore deleted versions. The {@code lock*} variants take row locks and only make
 * sense inside a transaction.</p>
 */
@Component
@RequiredArgsConstructor
public class ResumeTreeStore {

    private final ResumeNodeRepository nodeRepository;

    public Mono<ResumeNode> findActive(Long id) {
        return nodeRepository.findActiveById(id)
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("resume lookup", e));
    }

    public Mono<ResumeNode> lockActive(Long id) {
        return nodeRepository.findActiveByIdForUpdate(id)
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("resume lock", e));
    }

    public Mono<ResumeNode> insert(ResumeNode node) {
        return nodeRepository.save(node)
                .doOnNext(saved -> saved.setNewRecord(false))
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("resume insert", e));
    }

    public Mono<ResumeNode> update(ResumeNode node) {
        return nodeRepository.save(node)
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("resume update", e));
    }

    public Mono<ResumeNode> updateStatus(ResumeNode node, ResumeNodeStatus status, LocalDateTime now) {
        return Mono.defer(() -> {
            node.setStatus(status.value());
            node.setUpdatedAt(now);
            return update(node);
        });
    }

    /**
     * Ids of {@code rootId} and all of its non-deleted descendants, breadth first.
     * Each visited child row is locked so no fork can attach below the subtree while it is collected.
     */
    public Flux<Long> collectSubtreeIds(Long rootId) {
        return Flux.just(rootId)
                .expand(nodeRepository::findActiveChildIdsForUpdate)
                .distinct()
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("subtree traversal", e));
    }

    /**
     * Marks the given versions deleted in one statement.
     *
     * @return number of versions that changed state
     */
    public Mono<Long> markDeleted(Collection<Long> ids, LocalDateTime now) {
        if (ids.isEmpty()) {
            return Mono.just(0L);
        }
        return nodeRepository.markDeleted(ids, now)
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("subtree delete", e));
    }

    public Flux<ResumeNode> findActiveByOwner(String ownerIdentity) {
        return nodeRepository.findActiveByOwner(ownerIdentity)
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("owner scan", e));
    }

    public Flux<ResumeNode> findPublishedByOwner(String ownerIdentity) {
        return nodeRepository.findPublishedByOwner(ownerIdentity)
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("owner scan", e));
    }

    /**
     * Whether another live version of the owner already uses {@code name}. {@code excludeId} may be null.
     */
    public Mono<Boolean> isNameTaken(String ownerIdentity, String name, Long excludeId) {
        return nodeRepository.findActiveIdsByOwnerAndName(ownerIdentity, name)
                .filter(id -> !id.equals(excludeId))
                .hasElements()
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("name check", e));
    }

    public Mono<Long> countByOwnerAndStatus(String ownerIdentity, ResumeNodeStatus status) {
        return nodeRepository.countByOwnerAndStatus(ownerIdentity, status.value())
                .defaultIfEmpty(0L)
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("owner count", e));
    }
}
