package uk.gegc.livequiz.features.analytics.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalytics;

public interface SessionAnalyticsRepository extends JpaRepository<SessionAnalytics, String> {
}
