package uk.gegc.livequiz.features.ranking.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.livequiz.features.ranking.domain.model.ItemRating;

import java.util.List;
import java.util.Optional;

public interface ItemRatingRepository extends JpaRepository<ItemRating, Long> {

    Optional<ItemRating> findByParticipantIdAndItemIdAndMetricId(String participantId, Long itemId, Long metricId);

    List<ItemRating> findBySessionId(String sessionId);

    @Query("SELECT COUNT(DISTINCT r.participantId) FROM ItemRating r WHERE r.sessionId = :sessionId")
    long countRaters(@Param("sessionId") String sessionId);
}
