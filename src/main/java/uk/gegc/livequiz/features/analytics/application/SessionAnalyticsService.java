package uk.gegc.livequiz.features.analytics.application;

import uk.gegc.livequiz.features.analytics.api.dto.ComputeAnalyticsResponse;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalyticsReport;

public interface SessionAnalyticsService {

    /**
     * Builds and stores the analytics document of an ended session. Host only.
     */
    ComputeAnalyticsResponse computeSessionAnalytics(String sessionId, String username);

    SessionAnalyticsReport getSessionAnalytics(String sessionId, String username);
}
