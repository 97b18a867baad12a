package uk.gegc.livequiz.features.ranking.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.livequiz.features.ranking.api.dto.ComputeRankingResultsResponse;
import uk.gegc.livequiz.features.ranking.api.dto.SubmitRatingsRequest;
import uk.gegc.livequiz.features.ranking.api.dto.SubmitRatingsResponse;
import uk.gegc.livequiz.features.ranking.application.RankingResultsService;
import uk.gegc.livequiz.features.ranking.application.RankingService;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent;

@Tag(name = "Ranking", description = "Item ratings and ranking results")
@RestController
@RequestMapping("/api/v1/sessions/{sessionId}")
@RequiredArgsConstructor
public class RankingController {

    private final RankingService rankingService;
    private final RankingResultsService rankingResultsService;

    @Operation(summary = "Submit ratings", description = "Rates approved items on the session's metrics. Re-rating replaces the earlier value.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ratings recorded",
                    content = @Content(schema = @Schema(implementation = SubmitRatingsResponse.class))),
            @ApiResponse(responseCode = "400", description = "Value outside the metric scale",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Unknown session, participant, item or metric",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session is not accepting ratings",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/ratings")
    public ResponseEntity<SubmitRatingsResponse> submitRatings(
            @PathVariable String sessionId,
            @RequestBody @Valid SubmitRatingsRequest request
    ) {
        return ResponseEntity.ok(rankingService.submitRatings(sessionId, request));
    }

    @Operation(summary = "Compute ranking results", description = "Host command. Ranks approved items and moves the session to RESULTS.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Results computed",
                    content = @Content(schema = @Schema(implementation = ComputeRankingResultsResponse.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not the session host",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Not a ranking session or nothing to rank",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/ranking-results")
    public ResponseEntity<ComputeRankingResultsResponse> computeRankingResults(
            @PathVariable String sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(rankingResultsService.computeRankingResults(sessionId, authentication.getName()));
    }

    @Operation(summary = "Get ranking results")
    @GetMapping("/ranking-results")
    public ResponseEntity<RankingResultsContent> getRankingResults(@PathVariable String sessionId) {
        return ResponseEntity.ok(rankingResultsService.getRankingResults(sessionId));
    }
}
