package uk.gegc.livequiz.features.session.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.livequiz.features.session.api.dto.*;
import uk.gegc.livequiz.features.session.application.SessionService;

@Tag(name = "Sessions", description = "Live session lifecycle: creation, joining and host transitions")
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;

    @Operation(
            summary = "Create a session",
            description = "Creates a session in LOBBY state. The caller becomes the host. The answer key is stored server-side and never returned."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session created",
                    content = @Content(schema = @Schema(implementation = SessionDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid questions, metrics or items",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Not authenticated",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<SessionDto> createSession(
            @RequestBody @Valid CreateSessionRequest request,
            Authentication authentication
    ) {
        SessionDto created = sessionService.createSession(authentication.getName(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Get a session", description = "Host-only view of the session state.")
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionDto> getSession(
            @Parameter(description = "Session identifier", required = true)
            @PathVariable String sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(sessionService.getSession(sessionId, authentication.getName()));
    }

    @Operation(
            summary = "Join a session",
            description = "Adds a participant. The returned id identifies the participant in answer and rating submissions."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Joined",
                    content = @Content(schema = @Schema(implementation = ParticipantDto.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session has ended",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/participants")
    public ResponseEntity<ParticipantDto> joinSession(
            @PathVariable String sessionId,
            @RequestBody @Valid JoinSessionRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.joinSession(sessionId, request));
    }

    @Operation(
            summary = "Change session state",
            description = "Host command. Entering QUESTION opens the answer window of the given question; the question index never moves backwards."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "State changed",
                    content = @Content(schema = @Schema(implementation = SessionDto.class))),
            @ApiResponse(responseCode = "400", description = "Unknown question or backwards move",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not the session host",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session has ended",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/state")
    public ResponseEntity<SessionDto> transitionState(
            @PathVariable String sessionId,
            @RequestBody @Valid TransitionStateRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(sessionService.transitionState(sessionId, request, authentication.getName()));
    }
}
