package uk.gegc.livequiz.features.leaderboard.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.livequiz.features.leaderboard.api.dto.LeaderboardSnapshotDto;
import uk.gegc.livequiz.features.leaderboard.api.dto.QuestionResultsResponse;
import uk.gegc.livequiz.features.leaderboard.application.LeaderboardAggregator;

@Tag(name = "Leaderboard", description = "Per-question results and the leaderboard snapshot")
@RestController
@RequestMapping("/api/v1/sessions/{sessionId}")
@RequiredArgsConstructor
@Validated
public class LeaderboardController {

    private final LeaderboardAggregator leaderboardAggregator;

    @Operation(
            summary = "Compute question results",
            description = "Host command run once the host moves past a question. Replaces the leaderboard snapshot and updates streaks."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Snapshot written",
                    content = @Content(schema = @Schema(implementation = QuestionResultsResponse.class))),
            @ApiResponse(responseCode = "400", description = "Question not reached yet",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not the session host",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session or question not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/questions/{questionIndex}/results")
    public ResponseEntity<QuestionResultsResponse> computeQuestionResults(
            @PathVariable String sessionId,
            @PathVariable @Min(0) int questionIndex,
            Authentication authentication
    ) {
        return ResponseEntity.ok(leaderboardAggregator.computeQuestionResults(sessionId, questionIndex, authentication.getName()));
    }

    @Operation(summary = "Get the leaderboard", description = "Latest snapshot computed for the session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Snapshot returned",
                    content = @Content(schema = @Schema(implementation = LeaderboardSnapshotDto.class))),
            @ApiResponse(responseCode = "404", description = "Session not found or no snapshot yet",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/leaderboard")
    public ResponseEntity<LeaderboardSnapshotDto> getLeaderboard(@PathVariable String sessionId) {
        return ResponseEntity.ok(leaderboardAggregator.getLeaderboard(sessionId));
    }
}
