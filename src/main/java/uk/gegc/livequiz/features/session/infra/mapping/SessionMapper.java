package uk.gegc.livequiz.features.session.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.ranking.domain.model.RankingItem;
import uk.gegc.livequiz.features.ranking.domain.model.RankingMetric;
import uk.gegc.livequiz.features.session.api.dto.AnswerKeyRequest;
import uk.gegc.livequiz.features.session.api.dto.ParticipantDto;
import uk.gegc.livequiz.features.session.api.dto.RankingItemRequest;
import uk.gegc.livequiz.features.session.api.dto.RankingMetricRequest;
import uk.gegc.livequiz.features.session.api.dto.SessionDto;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;
import uk.gegc.livequiz.features.session.domain.model.Participant;

import java.util.ArrayList;
import java.util.List;

@Component
public class SessionMapper {

    public SessionDto toDto(LiveSession session, long questionCount, long participantCount) {
        return new SessionDto(
                session.getId(),
                session.getHostId(),
                session.getTitle(),
                session.getActivityType(),
                session.getState(),
                session.getCurrentQuestionIndex(),
                session.getQuestionStartTime(),
                questionCount,
                participantCount,
                session.getCreatedAt()
        );
    }

    public ParticipantDto toDto(Participant participant) {
        return new ParticipantDto(
                participant.getId(),
                participant.getSessionId(),
                participant.getDisplayName(),
                participant.getScore(),
                participant.getCurrentStreak(),
                participant.getJoinedAt()
        );
    }

    public AnswerKeyEntry toEntity(String sessionId, int questionIndex, AnswerKeyRequest request, int defaultTimeLimitSeconds) {
        AnswerKeyEntry entry = new AnswerKeyEntry();
        entry.setSessionId(sessionId);
        entry.setQuestionIndex(questionIndex);
        entry.setQuestionType(request.questionType());
        entry.setTimeLimitSeconds(request.timeLimitSeconds() != null ? request.timeLimitSeconds() : defaultTimeLimitSeconds);
        entry.setQuestionText(request.questionText());
        entry.setOptionLabels(request.optionLabels() != null ? new ArrayList<>(request.optionLabels()) : new ArrayList<>());
        entry.setCorrectIndex(request.correctIndex());
        entry.setCorrectIndices(request.correctIndices() != null ? List.copyOf(request.correctIndices()) : null);
        entry.setCorrectValue(request.correctValue());
        entry.setMinValue(request.minValue());
        entry.setMaxValue(request.maxValue());
        entry.setAcceptableError(request.acceptableError());
        entry.setCorrectText(request.correctText());
        entry.setAlternativeAnswers(request.alternativeAnswers() != null
                ? new ArrayList<>(request.alternativeAnswers())
                : new ArrayList<>());
        entry.setCaseSensitive(Boolean.TRUE.equals(request.caseSensitive()));
        entry.setAllowTypos(request.allowTypos() == null || request.allowTypos());
        return entry;
    }

    public RankingMetric toEntity(String sessionId, int displayOrder, RankingMetricRequest request) {
        RankingMetric metric = new RankingMetric();
        metric.setSessionId(sessionId);
        metric.setMetricKey(request.metricKey());
        metric.setName(request.name());
        metric.setScaleMin(request.scaleMin());
        metric.setScaleMax(request.scaleMax());
        metric.setWeight(request.weight() != null ? request.weight() : 1.0);
        metric.setLowerIsBetter(Boolean.TRUE.equals(request.lowerIsBetter()));
        metric.setDisplayOrder(displayOrder);
        return metric;
    }

    public RankingItem toEntity(String sessionId, int displayOrder, RankingItemRequest request) {
        RankingItem item = new RankingItem();
        item.setSessionId(sessionId);
        item.setItemKey(request.itemKey());
        item.setText(request.text());
        item.setDescription(request.description());
        item.setApproved(request.approved() == null || request.approved());
        item.setDisplayOrder(displayOrder);
        return item;
    }
}
