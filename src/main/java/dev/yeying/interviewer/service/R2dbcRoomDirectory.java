package dev.yeying.interviewer.service;

import dev.yeying.interviewer.entity.Room;
import dev.yeying.interviewer.exception.ResourceNotFoundException;
import dev.yeying.interviewer.exception.StorageFailureException;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * {@link RoomDirectory} over the shared {@code rooms} table.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class R2dbcRoomDirectory implements RoomDirectory {

    private static final String ROOM_COLUMNS = "id, name, owner_identity, resume_id, updated_at";

    private final DatabaseClient databaseClient;
    private final Clock clock;

    @Override
    public Mono<Room> findById(String roomId) {
        return databaseClient.sql("SELECT " + ROOM_COLUMNS + " FROM rooms WHERE id = :id")
                .bind("id", roomId)
                .map(R2dbcRoomDirectory::toRoom)
                .one()
                .onErrorMap(StorageFailureException::isStoreError,
                        e -> new StorageFailureException("room lookup", e));
    }

    @Override
    public Mono<Void> setResumeReference(String roomId, Long resumeId) {
        return databaseClient.sql("UPDATE rooms SET resume_id = :resumeId, updated_at = :updatedAt WHERE id = :id")
                .bind("resumeId", resumeId)
                .bind("updatedAt", LocalDateTime.now(clock))
                .bind("id", roomId)
                .fetch()
                .rowsUpdated()
                .onErrorMap(StorageFailureException::isStoreError,
                        e -> new StorageFailureException("room link", e))
                .flatMap(updated -> updated == 0
                        ? Mono.<Void>error(new ResourceNotFoundException("Room", roomId))
                        : Mono.<Void>empty())
                .doOnSuccess(ignored -> log.debug("Room {} now references resume {}", roomId, resumeId));
    }

    @Override
    public Flux<Room> findByResumeId(Long resumeId) {
        return databaseClient.sql("SELECT " + ROOM_COLUMNS + " FROM rooms WHERE resume_id = :resumeId ORDER BY id")
                .bind("resumeId", resumeId)
                .map(R2dbcRoomDirectory::toRoom)
                .all()
                .onErrorMap(StorageFailureException::isStoreError,
                        e -> new StorageFailureException("room listing", e));
    }

    @Override
    public Mono<Long> countLinkedToOwnerResumes(String ownerIdentity) {
        return databaseClient.sql("SELECT COUNT(*) FROM rooms r JOIN resume_nodes n ON r.resume_id = n.id " +
                        "WHERE n.owner_identity = :ownerIdentity AND n.status <> 'deleted'")
                .bind("ownerIdentity", ownerIdentity)
                .map(row -> row.get(0, Long.class))
                .one()
                .defaultIfEmpty(0L)
                .onErrorMap(StorageFailureException::isStoreError,
                        e -> new StorageFailureException("room count", e));
    }

    private static Room toRoom(Readable row) {
        return Room.builder()
                .id(row.get("id", String.class))
                .name(row.get("name", String.class))
                .ownerIdentity(row.get("owner_identity", String.class))
                .resumeId(row.get("resume_id", Long.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .build();
    }
}
