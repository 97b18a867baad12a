package uk.gegc.livequiz.features.question.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.features.question.infra.handler.QuestionHandler;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the {@link QuestionHandler} for a question type.
 * Startup fails if a type has no handler or more than one.
 */
@Component
@Slf4j
public class QuestionHandlerFactory {
    private final Map<QuestionType, QuestionHandler> handlersByType = new EnumMap<>(QuestionType.class);

    public QuestionHandlerFactory(List<QuestionHandler> handlers) {
        for (QuestionHandler handler : handlers) {
            QuestionHandler previous = handlersByType.put(handler.supportedType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for " + handler.supportedType() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }

        Set<QuestionType> missing = EnumSet.allOf(QuestionType.class);
        missing.removeAll(handlersByType.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for question types " + missing);
        }

        log.info("Scoring handlers registered for {}", handlersByType.keySet());
    }

    public QuestionHandler getHandler(QuestionType type) {
        return handlersByType.get(type);
    }
}
