package uk.gegc.livequiz.features.session.application;

import lombok.RequiredArgsConstructor;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;
import uk.gegc.livequiz.features.session.domain.repository.LiveSessionRepository;
import uk.gegc.livequiz.shared.exception.ResourceNotFoundException;

/**
 * Session lookup and host ownership checks shared by the host-only operations.
 */
@Service
@RequiredArgsConstructor
public class SessionAccessService {

    private final LiveSessionRepository sessionRepository;

    public LiveSession requireSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session " + sessionId + " not found"));
    }

    public LiveSession requireHostedSession(String sessionId, String username) {
        LiveSession session = requireSession(sessionId);
        if (!session.isHostedBy(username)) {
            throw new AccessDeniedException("Only the host of session " + sessionId + " can perform this action");
        }
        return session;
    }
}
