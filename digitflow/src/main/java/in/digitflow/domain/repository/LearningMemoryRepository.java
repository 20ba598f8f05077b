package in.digitflow.domain.repository;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One upsertable learning document per market.
 */
public interface LearningMemoryRepository {

    /**
     * Raw stored document with the schema version it was written under.
     */
    record StoredDocument(String market, int schemaVersion, JsonNode document) {}

    Optional<StoredDocument> load(String market);

    /**
     * Insert or replace the market's document. Last write wins.
     */
    void save(String market, int schemaVersion, JsonNode document);

    void delete(String market);
}
