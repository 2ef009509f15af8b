package dev.yeying.interviewer.controller;

import dev.yeying.interviewer.dto.CreateResumeRequest;
import dev.yeying.interviewer.dto.DeleteTreeResponse;
import dev.yeying.interviewer.dto.ResumeContentRequest;
import dev.yeying.interviewer.dto.ResumeContentResponse;
import dev.yeying.interviewer.dto.ResumeNodeDetailResponse;
import dev.yeying.interviewer.dto.ResumeNodeResponse;
import dev.yeying.interviewer.dto.ResumeTreeStats;
import dev.yeying.interviewer.dto.ResumeTreeView;
import dev.yeying.interviewer.dto.UpdateResumeMetadataRequest;
import dev.yeying.interviewer.service.ResumeTreeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Versioned resumes of the calling user.
 */
@RestController
@RequestMapping("/api/v1/resumes")
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Resume Versions", description = "Create, fork, publish and retire resume versions")
public class ResumeTreeController {

    private final ResumeTreeService resumeTreeService;

    @Operation(summary = "Start a new resume tree")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Root version created"),
        @ApiResponse(responseCode = "400", description = "Invalid request data")
    })
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ResumeNodeResponse> createRoot(@Valid @RequestBody CreateResumeRequest request,
                                               Authentication authentication) {
        return callerIdentity(authentication)
                .flatMap(identity -> resumeTreeService.createRoot(identity, request.getName(),
                        request.getTargetCompany(), request.getTargetPosition()))
                .map(ResumeNodeResponse::fromEntity);
    }

    @Operation(summary = "List the caller's resume trees", description = "Deleted versions are left out")
    @GetMapping("/trees")
    public Mono<List<ResumeTreeView>> listTrees(Authentication authentication) {
        return callerIdentity(authentication).flatMap(resumeTreeService::listTrees);
    }

    @Operation(summary = "List published versions available for interviews")
    @GetMapping("/published")
    public Mono<List<ResumeNodeResponse>> getAvailablePublished(Authentication authentication) {
        return callerIdentity(authentication)
                .flatMapMany(resumeTreeService::getAvailablePublished)
                .map(ResumeNodeResponse::fromEntity)
                .collectList();
    }

    @Operation(summary = "Version counts of the caller")
    @GetMapping("/stats")
    public Mono<ResumeTreeStats> getStats(Authentication authentication) {
        return callerIdentity(authentication).flatMap(resumeTreeService::getStats);
    }

    @Operation(summary = "Get a version with its content and linked rooms")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Version found"),
        @ApiResponse(responseCode = "403", description = "Version belongs to another user"),
        @ApiResponse(responseCode = "404", description = "Version not found or deleted")
    })
    @GetMapping("/{id}")
    public Mono<ResumeNodeDetailResponse> getNode(@Parameter(description = "Version ID") @PathVariable Long id,
                                                  Authentication authentication) {
        return callerIdentity(authentication).flatMap(identity -> resumeTreeService.getNode(id, identity));
    }

    @Operation(summary = "Rename a version or change its target company and position")
    @PatchMapping("/{id}")
    public Mono<ResumeNodeResponse> updateMetadata(@PathVariable Long id,
                                                   @Valid @RequestBody UpdateResumeMetadataRequest request,
                                                   Authentication authentication) {
        return callerIdentity(authentication)
                .flatMap(identity -> resumeTreeService.updateMetadata(id, identity, request))
                .map(ResumeNodeResponse::fromEntity);
    }

    @Operation(summary = "Delete a version and every version forked from it")
    @DeleteMapping("/{id}")
    public Mono<DeleteTreeResponse> deleteTree(@PathVariable Long id, Authentication authentication) {
        return callerIdentity(authentication)
                .flatMap(identity -> resumeTreeService.deleteTree(id, identity))
                .map(DeleteTreeResponse::new);
    }

    @Operation(summary = "Fork a version into a new draft")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Draft created"),
        @ApiResponse(responseCode = "409", description = "Tree depth limit reached")
    })
    @PostMapping("/{id}/fork")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ResumeNodeResponse> fork(@PathVariable Long id, Authentication authentication) {
        return callerIdentity(authentication)
                .flatMap(identity -> resumeTreeService.fork(id, identity))
                .map(ResumeNodeResponse::fromEntity);
    }

    @Operation(summary = "Publish a version")
    @PostMapping("/{id}/publish")
    public Mono<ResumeNodeResponse> publish(@PathVariable Long id, Authentication authentication) {
        return callerIdentity(authentication)
                .flatMap(identity -> resumeTreeService.publish(id, identity))
                .map(ResumeNodeResponse::fromEntity);
    }

    @Operation(summary = "Move a version back to draft")
    @PostMapping("/{id}/unpublish")
    public Mono<ResumeNodeResponse> unpublish(@PathVariable Long id, Authentication authentication) {
        return callerIdentity(authentication)
                .flatMap(identity -> resumeTreeService.unpublish(id, identity))
                .map(ResumeNodeResponse::fromEntity);
    }

    @Operation(summary = "Get the content of a version")
    @GetMapping("/{id}/content")
    public Mono<ResumeContentResponse> getContent(@PathVariable Long id, Authentication authentication) {
        return callerIdentity(authentication).flatMap(identity -> resumeTreeService.getContent(id, identity));
    }

    @Operation(summary = "Update the content of a version",
               description = "Only supplied fields change. A published version returns to draft.")
    @PutMapping("/{id}/content")
    public Mono<ResumeContentResponse> updateContent(@PathVariable Long id,
                                                     @Valid @RequestBody ResumeContentRequest request,
                                                     Authentication authentication) {
        return callerIdentity(authentication)
                .flatMap(identity -> resumeTreeService.updateContent(id, identity, request));
    }

    @Operation(summary = "Use a published version in an interview room")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Room now references the version"),
        @ApiResponse(responseCode = "409", description = "Version is not published")
    })
    @PutMapping("/{id}/rooms/{roomId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> linkToRoom(@PathVariable Long id, @PathVariable String roomId,
                                 Authentication authentication) {
        return callerIdentity(authentication)
                .flatMap(identity -> resumeTreeService.linkToRoom(id, roomId, identity));
    }

    @Operation(summary = "Get the version an interview room uses")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Linked version"),
        @ApiResponse(responseCode = "204", description = "Room has no live version linked")
    })
    @GetMapping("/by-room/{roomId}")
    public Mono<ResponseEntity<ResumeNodeDetailResponse>> getResumeByRoom(@PathVariable String roomId,
                                                                          Authentication authentication) {
        return callerIdentity(authentication)
                .flatMap(identity -> resumeTreeService.getResumeByRoom(roomId, identity))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    private Mono<String> callerIdentity(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required"));
        }
        return Mono.just(authentication.getName());
    }
}
