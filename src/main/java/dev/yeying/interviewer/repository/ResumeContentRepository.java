package dev.yeying.interviewer.repository;

import dev.yeying.interviewer.entity.ResumeContent;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface ResumeContentRepository extends R2dbcRepository<ResumeContent, Long> {

    Mono<ResumeContent> findByResumeId(Long resumeId);
}
