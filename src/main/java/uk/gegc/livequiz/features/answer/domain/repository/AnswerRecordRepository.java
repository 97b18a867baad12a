package uk.gegc.livequiz.features.answer.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.livequiz.features.answer.domain.model.AnswerRecord;

import java.util.List;

public interface AnswerRecordRepository extends JpaRepository<AnswerRecord, Long> {

    boolean existsByParticipant_IdAndQuestionIndex(String participantId, int questionIndex);

    @Query("""
            SELECT a FROM AnswerRecord a
            WHERE a.participant.sessionId = :sessionId
              AND a.questionIndex = :questionIndex
            ORDER BY a.answeredAt ASC, a.id ASC
            """)
    List<AnswerRecord> findBySessionAndQuestion(@Param("sessionId") String sessionId,
                                                @Param("questionIndex") int questionIndex);
}
