package dev.yeying.interviewer.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SnowflakeId")
class SnowflakeIdTest {

    @Test
    @DisplayName("should issue increasing ids")
    void shouldIssueIncreasingIds() {
        SnowflakeId generator = new SnowflakeId(3);
        long previous = generator.nextId();
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            long next = generator.nextId();
            assertThat(next).isGreaterThan(previous);
            assertThat(seen.add(next)).isTrue();
            previous = next;
        }
    }

    @Test
    @DisplayName("should stay unique across threads")
    void shouldBeUniqueAcrossThreads() throws InterruptedException {
        SnowflakeId generator = new SnowflakeId(1);
        Set<Long> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 5_000; i++) {
                    ids.add(generator.nextId());
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(ids).hasSize(20_000);
    }

    @Test
    @DisplayName("should encode node and issue time")
    void shouldEncodeComponents() {
        long id = new SnowflakeId(42).nextId();

        assertThat(SnowflakeId.nodeOf(id)).isEqualTo(42);
        assertThat(SnowflakeId.issuedAt(id)).isBetween(Instant.now().minus(Duration.ofMinutes(1)), Instant.now().plusSeconds(1));
        assertThat(SnowflakeId.sequenceOf(id)).isBetween(0, 4095);
    }

    @Test
    @DisplayName("should reject node ids outside the 10-bit range")
    void shouldRejectInvalidNode() {
        assertThatThrownBy(() -> new SnowflakeId(1024)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SnowflakeId(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
