package uk.gegc.livequiz.features.session.domain.repository;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.livequiz.features.session.domain.model.Participant;

import java.util.List;
import java.util.Optional;

public interface ParticipantRepository extends JpaRepository<Participant, String> {

    Optional<Participant> findByIdAndSessionId(String id, String sessionId);

    long countBySessionId(String sessionId);

    /**
     * Every participant of a session with their full answer history, in one query.
     * Ordered by join time then id so callers iterate deterministically.
     */
    @EntityGraph(attributePaths = {"answers"})
    @Query("""
            SELECT DISTINCT p FROM Participant p
            WHERE p.sessionId = :sessionId
            ORDER BY p.joinedAt ASC, p.id ASC
            """)
    List<Participant> findAllWithAnswersBySessionId(@Param("sessionId") String sessionId);
}
