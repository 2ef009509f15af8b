package dev.yeying.interviewer.service;

import dev.yeying.interviewer.entity.ResumeNode;
import dev.yeying.interviewer.entity.Room;
import dev.yeying.interviewer.exception.PermissionDeniedException;
import dev.yeying.interviewer.metrics.ResumeTreeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OwnershipGuard")
class OwnershipGuardTest {

    private SimpleMeterRegistry meterRegistry;
    private OwnershipGuard guard;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ResumeTreeMetrics metrics = new ResumeTreeMetrics(meterRegistry);
        metrics.init();
        guard = new OwnershipGuard(metrics);
    }

    @Test
    @DisplayName("should pass a resume through to its owner")
    void shouldAllowOwner() {
        ResumeNode node = ResumeNode.builder().id(1L).ownerIdentity("alice").build();

        StepVerifier.create(guard.authorize("alice", node))
                .expectNext(node)
                .verifyComplete();
    }

    @Test
    @DisplayName("should apply the same rule to rooms")
    void shouldCheckRooms() {
        Room room = Room.builder().id("r-1").ownerIdentity("alice").build();

        StepVerifier.create(guard.authorize("bob", room))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(PermissionDeniedException.class)
                        .hasMessageContaining("room r-1"))
                .verify();

        assertThat(meterRegistry.counter("resume.tree.permission.denied").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should never match a resource without owner")
    void shouldDenyOwnerless() {
        Room room = Room.builder().id("r-2").build();

        assertThat(guard.isOwner(null, room)).isFalse();
        StepVerifier.create(guard.authorize(null, room))
                .expectError(PermissionDeniedException.class)
                .verify();
    }

    @Test
    @DisplayName("should compare identities exactly")
    void shouldBeCaseSensitive() {
        ResumeNode node = ResumeNode.builder().id(1L).ownerIdentity("alice").build();

        assertThat(guard.isOwner("Alice", node)).isFalse();
    }
}
