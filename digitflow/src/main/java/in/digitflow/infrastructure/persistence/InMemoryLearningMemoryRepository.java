package in.digitflow.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import in.digitflow.domain.repository.LearningMemoryRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local learning store (LEARNING_STORE=memory). Learning is lost on restart.
 */
public final class InMemoryLearningMemoryRepository implements LearningMemoryRepository {

    private final Map<String, StoredDocument> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<StoredDocument> load(String market) {
        return Optional.ofNullable(documents.get(market));
    }

    @Override
    public void save(String market, int schemaVersion, JsonNode document) {
        documents.put(market, new StoredDocument(market, schemaVersion, document.deepCopy()));
    }

    @Override
    public void delete(String market) {
        documents.remove(market);
    }

    public int size() {
        return documents.size();
    }
}
