package dev.yeying.interviewer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.yeying.interviewer.dto.CertificationEntry;
import dev.yeying.interviewer.dto.EducationEntry;
import dev.yeying.interviewer.dto.ExperienceEntry;
import dev.yeying.interviewer.dto.ProjectEntry;
import dev.yeying.interviewer.dto.ResumeContentRequest;
import dev.yeying.interviewer.dto.ResumeContentResponse;
import dev.yeying.interviewer.dto.SkillEntry;
import dev.yeying.interviewer.entity.ResumeContent;
import dev.yeying.interviewer.exception.StorageFailureException;
import dev.yeying.interviewer.exception.ValidationException;
import dev.yeying.interviewer.repository.ResumeContentRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Content records of resume versions, keyed by version id.
 * Sections are stored as JSON arrays and exposed as typed entries.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResumeContentService {

    private static final TypeReference<List<EducationEntry>> EDUCATION = new TypeReference<>() {};
    private static final TypeReference<List<ExperienceEntry>> EXPERIENCE = new TypeReference<>() {};
    private static final TypeReference<List<ProjectEntry>> PROJECTS = new TypeReference<>() {};
    private static final TypeReference<List<SkillEntry>> SKILLS = new TypeReference<>() {};
    private static final TypeReference<List<CertificationEntry>> CERTIFICATIONS = new TypeReference<>() {};

    private final ResumeContentRepository contentRepository;
    private final IdService idService;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Clock clock;

    /**
     * Typed content of a version; empty when the version has no record.
     */
    public Mono<ResumeContentResponse> get(Long resumeId) {
        return findRecord(resumeId).map(this::toResponse);
    }

    public Mono<ResumeContent> findRecord(Long resumeId) {
        return contentRepository.findByResumeId(resumeId)
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("content lookup", e));
    }

    public Mono<ResumeContent> createEmpty(Long resumeId) {
        return insert(newRecord(resumeId));
    }

    /**
     * Existing record of the version, or a freshly inserted empty one.
     */
    public Mono<ResumeContent> ensureExists(Long resumeId) {
        return findRecord(resumeId).switchIfEmpty(Mono.defer(() -> createEmpty(resumeId)));
    }

    /**
     * Applies the non-null fields of {@code fields}, creating the record if the version has none.
     */
    public Mono<ResumeContentResponse> upsert(Long resumeId, ResumeContentRequest fields) {
        return validate(fields)
                .flatMap(valid -> findRecord(resumeId)
                        .switchIfEmpty(Mono.fromSupplier(() -> newRecord(resumeId)))
                        .map(content -> apply(content, valid)))
                .flatMap(content -> content.isNew()
                        ? insert(content)
                        : contentRepository.save(content)
                                .onErrorMap(StorageFailureException::isStoreError,
                                        e -> new StorageFailureException("content update", e)))
                .map(this::toResponse);
    }

    /**
     * Duplicates every field of the source version's content onto a new record for {@code toResumeId}.
     * The copy shares nothing with the source, so later edits on either side stay local.
     */
    public Mono<ResumeContent> copy(Long fromResumeId, Long toResumeId) {
        return findRecord(fromResumeId)
                .map(source -> source.toBuilder()
                        .id(idService.nextId())
                        .newRecord(true)
                        .resumeId(toResumeId)
                        .createdAt(LocalDateTime.now(clock))
                        .updatedAt(LocalDateTime.now(clock))
                        .build())
                .switchIfEmpty(Mono.fromSupplier(() -> newRecord(toResumeId)))
                .flatMap(this::insert);
    }

    /**
     * Checks the bean constraints of a content update, failing with the first violation.
     */
    public Mono<ResumeContentRequest> validate(ResumeContentRequest fields) {
        if (fields == null) {
            return Mono.error(new ValidationException("Content fields are required"));
        }
        Set<ConstraintViolation<ResumeContentRequest>> violations = validator.validate(fields);
        if (violations.isEmpty()) {
            return Mono.just(fields);
        }
        ConstraintViolation<ResumeContentRequest> first = violations.stream()
                .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .orElseThrow();
        return Mono.error(new ValidationException(first.getPropertyPath() + ": " + first.getMessage()));
    }

    public ResumeContentResponse toResponse(ResumeContent content) {
        return ResumeContentResponse.builder()
                .resumeId(String.valueOf(content.getResumeId()))
                .fullName(content.getFullName())
                .email(content.getEmail())
                .phone(content.getPhone())
                .location(content.getLocation())
                .website(content.getWebsite())
                .summary(content.getSummary())
                .education(fromJsonArray(content.getEducation(), EDUCATION))
                .experience(fromJsonArray(content.getExperience(), EXPERIENCE))
                .projects(fromJsonArray(content.getProjects(), PROJECTS))
                .skills(fromJsonArray(content.getSkills(), SKILLS))
                .certifications(fromJsonArray(content.getCertifications(), CERTIFICATIONS))
                .updatedAt(content.getUpdatedAt())
                .build();
    }

    private ResumeContent apply(ResumeContent content, ResumeContentRequest fields) {
        if (fields.getFullName() != null) content.setFullName(fields.getFullName());
        if (fields.getEmail() != null) content.setEmail(fields.getEmail());
        if (fields.getPhone() != null) content.setPhone(fields.getPhone());
        if (fields.getLocation() != null) content.setLocation(fields.getLocation());
        if (fields.getWebsite() != null) content.setWebsite(fields.getWebsite());
        if (fields.getSummary() != null) content.setSummary(fields.getSummary());
        if (fields.getEducation() != null) content.setEducation(toJsonArray(fields.getEducation()));
        if (fields.getExperience() != null) content.setExperience(toJsonArray(fields.getExperience()));
        if (fields.getProjects() != null) content.setProjects(toJsonArray(fields.getProjects()));
        if (fields.getSkills() != null) content.setSkills(toJsonArray(fields.getSkills()));
        if (fields.getCertifications() != null) content.setCertifications(toJsonArray(fields.getCertifications()));
        content.setUpdatedAt(LocalDateTime.now(clock));
        return content;
    }

    private ResumeContent newRecord(Long resumeId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return ResumeContent.builder()
                .id(idService.nextId())
                .resumeId(resumeId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private Mono<ResumeContent> insert(ResumeContent content) {
        return contentRepository.save(content)
                .doOnNext(saved -> saved.setNewRecord(false))
                .onErrorMap(StorageFailureException::isStoreError, e -> new StorageFailureException("content insert", e));
    }

    private String toJsonArray(List<?> entries) {
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize resume section", e);
        }
    }

    private <T> List<T> fromJsonArray(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable resume section, returning it empty: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
}
