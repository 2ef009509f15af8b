package dev.yeying.interviewer.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ResumeTreeMetrics {

    private final MeterRegistry meterRegistry;

    private Counter createdCounter;
    private Counter forkedCounter;
    private Counter deletedNodesCounter;
    private Counter publishedCounter;
    private Counter permissionDeniedCounter;

    @PostConstruct
    public void init() {
        createdCounter = Counter.builder("resume.tree.created")
                .description("Resume trees created")
                .register(meterRegistry);
        forkedCounter = Counter.builder("resume.tree.forked")
                .description("Resume versions forked from an existing node")
                .register(meterRegistry);
        deletedNodesCounter = Counter.builder("resume.tree.deleted.nodes")
                .description("Resume nodes marked deleted by subtree deletion")
                .register(meterRegistry);
        publishedCounter = Counter.builder("resume.tree.published")
                .description("Draft resume nodes moved to published")
                .register(meterRegistry);
        permissionDeniedCounter = Counter.builder("resume.tree.permission.denied")
                .description("Operations rejected because the caller does not own the resource")
                .register(meterRegistry);
    }

    public void recordCreated() {
        createdCounter.increment();
    }

    public void recordForked() {
        forkedCounter.increment();
    }

    public void recordDeletedNodes(long count) {
        if (count > 0) {
            deletedNodesCounter.increment(count);
        }
    }

    public void recordPublished() {
        publishedCounter.increment();
    }

    public void recordPermissionDenied() {
        permissionDeniedCounter.increment();
    }
}
