package in.digitflow.domain.repository;

import in.digitflow.domain.session.Participant;
import in.digitflow.domain.session.ParticipantStatus;
import in.digitflow.domain.session.SessionStatus;
import in.digitflow.domain.session.TradingSession;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to sessions and participants owned by the bookkeeping store,
 * plus the few status write-backs the engine performs.
 */
public interface SessionRepository {
    /**
     * Find a session by id, normalized regardless of which schema stores it.
     */
    Optional<TradingSession> findSession(String sessionId);

    /**
     * Participants still active in the session, each with their linked trading account.
     */
    List<Participant> findActiveParticipants(String sessionId);

    /**
     * Net profit of closed trades for the session since the given instant.
     */
    BigDecimal realizedProfitSince(String sessionId, Instant since);

    void updateParticipantStatus(String participantId, ParticipantStatus status);

    void updateSessionStatus(String sessionId, SessionStatus status);
}
