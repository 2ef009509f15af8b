package dev.yeying.interviewer.service;

import dev.yeying.interviewer.entity.Room;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Access to interview rooms owned by the room subsystem. Only the resume back-reference is writable here.
 */
public interface RoomDirectory {

    Mono<Room> findById(String roomId);

    /**
     * Points the room at the given resume version, replacing any previous reference.
     */
    Mono<Void> setResumeReference(String roomId, Long resumeId);

    Flux<Room> findByResumeId(Long resumeId);

    /**
     * Number of rooms referencing any non-deleted resume version owned by {@code ownerIdentity}.
     */
    Mono<Long> countLinkedToOwnerResumes(String ownerIdentity);
}
