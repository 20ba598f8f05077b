package in.digitflow.domain.repository;

import in.digitflow.domain.session.RecoveryState;

import java.util.Optional;

public interface RecoveryStateRepository {
    Optional<RecoveryState> find(String sessionId);

    void save(RecoveryState state);
}
