package uk.gegc.livequiz.features.question.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;

@Component
public class PollMultipleHandler extends PollHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.POLL_MULTIPLE;
    }

    @Override
    protected Class<? extends SubmissionPayload> acceptedPayload() {
        return SubmissionPayload.MultiChoiceAnswer.class;
    }
}
