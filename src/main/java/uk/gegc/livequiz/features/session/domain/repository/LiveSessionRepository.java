package uk.gegc.livequiz.features.session.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;

public interface LiveSessionRepository extends JpaRepository<LiveSession, String> {
}
