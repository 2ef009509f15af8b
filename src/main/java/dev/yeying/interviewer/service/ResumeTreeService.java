package dev.yeying.interviewer.service;

import dev.yeying.interviewer.dto.ResumeContentRequest;
import dev.yeying.interviewer.dto.ResumeContentResponse;
import dev.yeying.interviewer.dto.ResumeNodeDetailResponse;
import dev.yeying.interviewer.dto.ResumeNodeResponse;
import dev.yeying.interviewer.dto.ResumeTreeStats;
import dev.yeying.interviewer.dto.ResumeTreeView;
import dev.yeying.interviewer.dto.UpdateResumeMetadataRequest;
import dev.yeying.interviewer.entity.ResumeNode;
import dev.yeying.interviewer.entity.ResumeNodeStatus;
import dev.yeying.interviewer.entity.Room;
import dev.yeying.interviewer.exception.DepthLimitExceededException;
import dev.yeying.interviewer.exception.NotPublishedException;
import dev.yeying.interviewer.exception.ResourceNotFoundException;
import dev.yeying.interviewer.exception.ValidationException;
import dev.yeying.interviewer.metrics.ResumeTreeMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned resume trees: creation, forking, publishing, content edits, room links and subtree deletion.
 *
 * <p>Every operation receives the caller identity explicitly. Mutations run in a single transaction
 * and report failures through the returned publisher's error signal.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResumeTreeService {

    /** Number of levels a tree may hold; roots sit at depth 0. */
    public static final int MAX_DEPTH = 5;

    private static final DateTimeFormatter FORK_NAME_FORMAT = DateTimeFormatter.ofPattern("MMddHHmm");

    private final ResumeTreeStore treeStore;
    private final ResumeContentService contentService;
    private final OwnershipGuard ownershipGuard;
    private final RoomDirectory roomDirectory;
    private final IdService idService;
    private final ResumeTreeMetrics metrics;
    private final Clock clock;

    @Transactional
    public Mono<ResumeNode> createRoot(String ownerIdentity, String name, String targetCompany, String targetPosition) {
        if (ownerIdentity == null || ownerIdentity.isBlank()) {
            return Mono.error(new ValidationException("Owner identity is required"));
        }
        if (name == null || name.isBlank()) {
            return Mono.error(new ValidationException("Resume name must not be empty"));
        }
        String trimmedName = name.trim();
        return requireUniqueName(ownerIdentity, trimmedName, null).then(Mono.defer(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            long id = idService.nextId();
            ResumeNode root = ResumeNode.builder()
                    .id(id)
                    .rootId(id)
                    .depth(0)
                    .name(trimmedName)
                    .ownerIdentity(ownerIdentity)
                    .status(ResumeNodeStatus.DRAFT.value())
                    .targetCompany(targetCompany)
                    .targetPosition(targetPosition)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            return treeStore.insert(root)
                    .flatMap(saved -> contentService.createEmpty(saved.getId()).thenReturn(saved));
        })).doOnSuccess(root -> {
            log.info("Resume tree created: id={}, owner={}", root.getId(), ownerIdentity);
            metrics.recordCreated();
        });
    }

    /**
     * Creates a draft child of {@code parentId} carrying a copy of the parent's content.
     * The child is named after the current time ({@code MMddHHmm}); siblings may share a name.
     */
    @Transactional
    public Mono<ResumeNode> fork(Long parentId, String requesterIdentity) {
        return requireOwned(parentId, requesterIdentity, true)
                .flatMap(parent -> {
                    if (parent.getDepth() >= MAX_DEPTH - 1) {
                        return Mono.error(new DepthLimitExceededException(parent.getId(), MAX_DEPTH));
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    ResumeNode child = ResumeNode.builder()
                            .id(idService.nextId())
                            .parentId(parent.getId())
                            .rootId(parent.getRootId())
                            .depth(parent.getDepth() + 1)
                            .name(now.format(FORK_NAME_FORMAT))
                            .ownerIdentity(requesterIdentity)
                            .status(ResumeNodeStatus.DRAFT.value())
                            .targetCompany(parent.getTargetCompany())
                            .targetPosition(parent.getTargetPosition())
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return treeStore.insert(child)
                            .flatMap(saved -> contentService.copy(parent.getId(), saved.getId()).thenReturn(saved));
                })
                .doOnSuccess(child -> {
                    log.info("Resume forked: parent={}, child={}, depth={}", parentId, child.getId(), child.getDepth());
                    metrics.recordForked();
                });
    }

    /**
     * Marks the version and all of its live descendants deleted. Content rows are kept.
     *
     * @return number of versions marked deleted
     */
    @Transactional
    public Mono<Long> deleteTree(Long nodeId, String requesterIdentity) {
        return requireOwned(nodeId, requesterIdentity, true)
                .flatMap(node -> treeStore.collectSubtreeIds(node.getId()).collectList())
                .flatMap(ids -> treeStore.markDeleted(ids, LocalDateTime.now(clock)))
                .doOnSuccess(count -> {
                    log.info("Resume subtree deleted: root={}, versions={}", nodeId, count);
                    metrics.recordDeletedNodes(count);
                });
    }

    /**
     * Publishes the version. A missing content record is created empty so published versions always have content.
     */
    @Transactional
    public Mono<ResumeNode> publish(Long nodeId, String requesterIdentity) {
        return requireOwned(nodeId, requesterIdentity, true)
                .flatMap(node -> contentService.ensureExists(node.getId())
                        .then(Mono.defer(() -> {
                            if (ResumeNodeStatus.PUBLISHED.matches(node.getStatus())) {
                                return Mono.just(node);
                            }
                            return treeStore.updateStatus(node, ResumeNodeStatus.PUBLISHED, LocalDateTime.now(clock))
                                    .doOnNext(published -> {
                                        log.info("Resume published: id={}", published.getId());
                                        metrics.recordPublished();
                                    });
                        })));
    }

    @Transactional
    public Mono<ResumeNode> unpublish(Long nodeId, String requesterIdentity) {
        return requireOwned(nodeId, requesterIdentity, true)
                .flatMap(this::demoteIfPublished);
    }

    /**
     * Applies a partial content update. A published version goes back to draft first, since its
     * content no longer matches what was published.
     */
    @Transactional
    public Mono<ResumeContentResponse> updateContent(Long nodeId, String requesterIdentity,
                                                     ResumeContentRequest fields) {
        return requireOwned(nodeId, requesterIdentity, true)
                .flatMap(node -> contentService.validate(fields).thenReturn(node))
                .flatMap(this::demoteIfPublished)
                .flatMap(node -> contentService.upsert(node.getId(), fields))
                .doOnSuccess(content -> log.info("Resume content updated: id={}", nodeId));
    }

    /**
     * Renames the version or changes its target company and position. Status is left as is.
     */
    @Transactional
    public Mono<ResumeNode> updateMetadata(Long nodeId, String requesterIdentity, UpdateResumeMetadataRequest request) {
        if (request.getName() != null && request.getName().isBlank()) {
            return Mono.error(new ValidationException("Resume name must not be empty"));
        }
        return requireOwned(nodeId, requesterIdentity, true)
                .flatMap(node -> {
                    if (request.getName() == null || request.getName().trim().equals(node.getName())) {
                        return Mono.just(node);
                    }
                    return requireUniqueName(node.getOwnerIdentity(), request.getName().trim(), node.getId())
                            .thenReturn(node);
                })
                .flatMap(node -> {
                    if (request.getName() != null) {
                        node.setName(request.getName().trim());
                    }
                    if (request.getTargetCompany() != null) {
                        node.setTargetCompany(request.getTargetCompany());
                    }
                    if (request.getTargetPosition() != null) {
                        node.setTargetPosition(request.getTargetPosition());
                    }
                    node.setUpdatedAt(LocalDateTime.now(clock));
                    return treeStore.update(node);
                })
                .doOnSuccess(node -> log.info("Resume metadata updated: id={}", nodeId));
    }

    /**
     * Points a room owned by the caller at one of the caller's published versions.
     */
    @Transactional
    public Mono<Void> linkToRoom(Long nodeId, String roomId, String requesterIdentity) {
        return requireOwned(nodeId, requesterIdentity, true)
                .flatMap(node -> roomDirectory.findById(roomId)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Room", roomId)))
                        .flatMap(room -> ownershipGuard.authorize(requesterIdentity, room))
                        .flatMap(room -> {
                            if (!ResumeNodeStatus.PUBLISHED.matches(node.getStatus())) {
                                return Mono.<Void>error(new NotPublishedException(node.getId()));
                            }
                            return roomDirectory.setResumeReference(room.getId(), node.getId());
                        }))
                .doOnSuccess(ignored -> log.info("Resume {} linked to room {}", nodeId, roomId));
    }

    public Mono<ResumeNodeDetailResponse> getNode(Long nodeId, String requesterIdentity) {
        return requireOwned(nodeId, requesterIdentity, false)
                .flatMap(this::toDetail);
    }

    public Mono<ResumeContentResponse> getContent(Long nodeId, String requesterIdentity) {
        return requireOwned(nodeId, requesterIdentity, false)
                .flatMap(node -> contentService.get(node.getId())
                        .defaultIfEmpty(ResumeContentResponse.empty(node.getId())));
    }

    /**
     * Version referenced by a room the caller owns. Completes empty when the room references
     * nothing or the referenced version has been deleted.
     */
    public Mono<ResumeNodeDetailResponse> getResumeByRoom(String roomId, String requesterIdentity) {
        return roomDirectory.findById(roomId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Room", roomId)))
                .flatMap(room -> ownershipGuard.authorize(requesterIdentity, room))
                .filter(room -> room.getResumeId() != null)
                .flatMap(room -> treeStore.findActive(room.getResumeId()))
                .flatMap(this::toDetail);
    }

    /**
     * The caller's live versions as a forest. Roots and siblings are ordered oldest first.
     */
    public Mono<List<ResumeTreeView>> listTrees(String ownerIdentity) {
        return treeStore.findActiveByOwner(ownerIdentity)
                .collectList()
                .map(nodes -> assembleForest(ownerIdentity, nodes));
    }

    public Flux<ResumeNode> getAvailablePublished(String ownerIdentity) {
        return treeStore.findPublishedByOwner(ownerIdentity);
    }

    public Mono<ResumeTreeStats> getStats(String ownerIdentity) {
        return Mono.zip(
                        treeStore.countByOwnerAndStatus(ownerIdentity, ResumeNodeStatus.PUBLISHED),
                        treeStore.countByOwnerAndStatus(ownerIdentity, ResumeNodeStatus.DRAFT),
                        roomDirectory.countLinkedToOwnerResumes(ownerIdentity))
                .map(counts -> ResumeTreeStats.builder()
                        .published(counts.getT1())
                        .draft(counts.getT2())
                        .total(counts.getT1() + counts.getT2())
                        .linkedRooms(counts.getT3())
                        .build());
    }

    private Mono<ResumeNode> requireOwned(Long nodeId, String requesterIdentity, boolean lock) {
        Mono<ResumeNode> lookup = lock ? treeStore.lockActive(nodeId) : treeStore.findActive(nodeId);
        return lookup
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Resume", nodeId)))
                .flatMap(node -> ownershipGuard.authorize(requesterIdentity, node));
    }

    private Mono<Void> requireUniqueName(String ownerIdentity, String name, Long excludeId) {
        return treeStore.isNameTaken(ownerIdentity, name, excludeId)
                .flatMap(taken -> taken
                        ? Mono.<Void>error(new ValidationException("A resume named '" + name + "' already exists"))
                        : Mono.<Void>empty());
    }

    private Mono<ResumeNode> demoteIfPublished(ResumeNode node) {
        if (!ResumeNodeStatus.PUBLISHED.matches(node.getStatus())) {
            return Mono.just(node);
        }
        return treeStore.updateStatus(node, ResumeNodeStatus.DRAFT, LocalDateTime.now(clock))
                .doOnNext(demoted -> log.info("Resume moved back to draft: id={}", demoted.getId()));
    }

    private Mono<ResumeNodeDetailResponse> toDetail(ResumeNode node) {
        return Mono.zip(
                        contentService.get(node.getId()).defaultIfEmpty(ResumeContentResponse.empty(node.getId())),
                        roomDirectory.findByResumeId(node.getId()).map(this::toLinkedRoom).collectList())
                .map(parts -> ResumeNodeDetailResponse.builder()
                        .node(ResumeNodeResponse.fromEntity(node))
                        .content(parts.getT1())
                        .linkedRooms(parts.getT2())
                        .build());
    }

    private ResumeNodeDetailResponse.LinkedRoom toLinkedRoom(Room room) {
        return ResumeNodeDetailResponse.LinkedRoom.builder()
                .id(room.getId())
                .name(room.getName())
                .build();
    }

    private List<ResumeTreeView> assembleForest(String ownerIdentity, List<ResumeNode> nodes) {
        Map<Long, List<ResumeNode>> childrenByParent = new HashMap<>();
        List<ResumeTreeView> forest = new ArrayList<>();
        Deque<PendingView> pending = new ArrayDeque<>();
        for (ResumeNode node : nodes) {
            if (node.isRoot()) {
                ResumeTreeView view = ResumeTreeView.of(node);
                forest.add(view);
                pending.add(new PendingView(node.getId(), view));
            } else {
                childrenByParent.computeIfAbsent(node.getParentId(), key -> new ArrayList<>()).add(node);
            }
        }

        int attached = forest.size();
        while (!pending.isEmpty()) {
            PendingView current = pending.poll();
            for (ResumeNode child : childrenByParent.getOrDefault(current.nodeId(), List.of())) {
                ResumeTreeView childView = ResumeTreeView.of(child);
                current.view().getChildren().add(childView);
                pending.add(new PendingView(child.getId(), childView));
                attached++;
            }
        }

        if (attached < nodes.size()) {
            log.warn("Owner {} has {} live resume versions unreachable from any root", ownerIdentity,
                    nodes.size() - attached);
        }
        return forest;
    }

    private record PendingView(Long nodeId, ResumeTreeView view) {
    }
}
