package uk.gegc.livequiz.features.session.application;

import uk.gegc.livequiz.features.session.api.dto.CreateSessionRequest;
import uk.gegc.livequiz.features.session.api.dto.JoinSessionRequest;
import uk.gegc.livequiz.features.session.api.dto.ParticipantDto;
import uk.gegc.livequiz.features.session.api.dto.SessionDto;
import uk.gegc.livequiz.features.session.api.dto.TransitionStateRequest;

public interface SessionService {

    /**
     * Creates a session in LOBBY state hosted by {@code username}, writing its answer key once.
     */
    SessionDto createSession(String username, CreateSessionRequest request);

    SessionDto getSession(String sessionId, String username);

    ParticipantDto joinSession(String sessionId, JoinSessionRequest request);

    /**
     * Moves the session to another state. Entering QUESTION starts the answer window of that question.
     */
    SessionDto transitionState(String sessionId, TransitionStateRequest request, String username);
}
