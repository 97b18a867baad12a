package uk.gegc.livequiz.features.analytics.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.livequiz.features.analytics.api.dto.ComputeAnalyticsResponse;
import uk.gegc.livequiz.features.analytics.application.SessionAnalyticsService;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalyticsReport;

@Tag(name = "Analytics", description = "Post-session analytics for hosts")
@RestController
@RequestMapping("/api/v1/sessions/{sessionId}/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final SessionAnalyticsService analyticsService;

    @Operation(summary = "Compute session analytics", description = "Host command for an ended session. Replaces any earlier analytics.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Analytics computed",
                    content = @Content(schema = @Schema(implementation = ComputeAnalyticsResponse.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not the session host",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session not ended or nobody took part",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<ComputeAnalyticsResponse> computeAnalytics(
            @PathVariable String sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(analyticsService.computeSessionAnalytics(sessionId, authentication.getName()));
    }

    @Operation(summary = "Get session analytics", description = "Returns the stored analytics report.")
    @GetMapping
    public ResponseEntity<SessionAnalyticsReport> getAnalytics(
            @PathVariable String sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(analyticsService.getSessionAnalytics(sessionId, authentication.getName()));
    }
}
