package uk.gegc.livequiz.features.answer.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.livequiz.features.answer.domain.model.LiveQuestionProgress;

import java.util.Optional;

public interface LiveQuestionProgressRepository extends JpaRepository<LiveQuestionProgress, Long> {

    Optional<LiveQuestionProgress> findBySessionIdAndQuestionIndex(String sessionId, int questionIndex);
}
