package uk.gegc.livequiz.features.answer.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.livequiz.features.answer.api.dto.LiveProgressDto;
import uk.gegc.livequiz.features.answer.api.dto.SubmitAnswerRequest;
import uk.gegc.livequiz.features.answer.api.dto.SubmitAnswerResponse;
import uk.gegc.livequiz.features.answer.application.AnswerSubmissionService;
import uk.gegc.livequiz.features.answer.application.LiveProgressService;

@Tag(name = "Answers", description = "Answer submission and live answer progress")
@RestController
@RequestMapping("/api/v1/sessions/{sessionId}")
@RequiredArgsConstructor
@Validated
public class AnswerController {

    private final AnswerSubmissionService answerSubmissionService;
    private final LiveProgressService liveProgressService;

    @Operation(
            summary = "Submit an answer",
            description = """
                    Records the participant's answer to the current question and returns the authoritative score.
                    Each participant can answer a question once; the answer and the score increment are stored atomically.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer recorded",
                    content = @Content(schema = @Schema(implementation = SubmitAnswerResponse.class),
                            examples = @ExampleObject(name = "success", value = """
                                    {
                                      "success": true,
                                      "isCorrect": true,
                                      "isPartiallyCorrect": false,
                                      "points": 550,
                                      "newScore": 1650
                                    }
                                    """))),
            @ApiResponse(responseCode = "400", description = "Malformed or inconsistent submission",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session, question or participant not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Question not open or already answered",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many submissions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/answers")
    public ResponseEntity<SubmitAnswerResponse> submitAnswer(
            @Parameter(description = "Session identifier", required = true)
            @PathVariable String sessionId,

            @RequestBody @Valid SubmitAnswerRequest request
    ) {
        return ResponseEntity.ok(answerSubmissionService.submitAnswer(sessionId, request));
    }

    @Operation(
            summary = "Get live answer progress",
            description = "Host-only counters for a question. Counts are updated asynchronously and can lag behind."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Progress returned",
                    content = @Content(schema = @Schema(implementation = LiveProgressDto.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not the session host",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/questions/{questionIndex}/progress")
    public ResponseEntity<LiveProgressDto> getProgress(
            @PathVariable String sessionId,
            @PathVariable @Min(0) int questionIndex,
            Authentication authentication
    ) {
        return ResponseEntity.ok(liveProgressService.getProgress(sessionId, questionIndex, authentication.getName()));
    }
}
