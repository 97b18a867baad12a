package uk.gegc.livequiz.features.question.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;

import java.util.List;
import java.util.Optional;

public interface AnswerKeyEntryRepository extends JpaRepository<AnswerKeyEntry, Long> {

    Optional<AnswerKeyEntry> findBySessionIdAndQuestionIndex(String sessionId, int questionIndex);

    List<AnswerKeyEntry> findBySessionIdOrderByQuestionIndexAsc(String sessionId);

    List<AnswerKeyEntry> findBySessionIdAndQuestionIndexLessThanEqualOrderByQuestionIndexAsc(String sessionId, int questionIndex);

    long countBySessionId(String sessionId);
}
