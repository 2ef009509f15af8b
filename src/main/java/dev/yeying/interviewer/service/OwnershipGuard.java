package dev.yeying.interviewer.service;

import dev.yeying.interviewer.entity.OwnedResource;
import dev.yeying.interviewer.exception.PermissionDeniedException;
import dev.yeying.interviewer.metrics.ResumeTreeMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Lets a caller act on a resource only when the caller's identity equals the resource owner's.
 * Holds no per-request state; the same check serves resume versions and rooms.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OwnershipGuard {

    private final ResumeTreeMetrics metrics;

    public boolean isOwner(String identity, OwnedResource resource) {
        return identity != null && identity.equals(resource.getOwnerIdentity());
    }

    /**
     * Emits {@code resource} when owned by {@code identity}, otherwise fails with
     * {@link PermissionDeniedException}. A resource without an owner is never accessible.
     */
    public <T extends OwnedResource> Mono<T> authorize(String identity, T resource) {
        if (isOwner(identity, resource)) {
            return Mono.just(resource);
        }
        log.warn("Ownership check failed: caller={} resource={}", identity, resource.resourceDescriptor());
        metrics.recordPermissionDenied();
        return Mono.error(new PermissionDeniedException(resource.resourceDescriptor()));
    }
}
