package in.digitflow.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.digitflow.domain.repository.LearningMemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL implementation of LearningMemoryRepository.
 *
 * One JSONB row per market in {@code learning_memory}. A market that has never been written there
 * falls back to its {@code quant_memory} row, returned as a version 2 document
 * {@code {"weights_data": ..., "performance_data": ...}} for the migrator to upgrade.
 */
public final class PostgresLearningMemoryRepository implements LearningMemoryRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresLearningMemoryRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final int LEGACY_VERSION = 2;

    private final DataSource dataSource;

    public PostgresLearningMemoryRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<StoredDocument> load(String market) {
        String sql = "SELECT schema_version, record FROM learning_memory WHERE market = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, market);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    JsonNode record = MAPPER.readTree(rs.getString("record"));
                    return Optional.of(new StoredDocument(market, rs.getInt("schema_version"), record));
                }
            }
            return loadLegacy(conn, market);

        } catch (Exception e) {
            log.error("Error loading learning memory for {}: {}", market, e.getMessage(), e);
            throw new RuntimeException("Failed to load learning memory", e);
        }
    }

    private Optional<StoredDocument> loadLegacy(Connection conn, String market) throws Exception {
        String sql = "SELECT weights_data, performance_data FROM quant_memory WHERE market = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, market);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                ObjectNode doc = MAPPER.createObjectNode();
                doc.set("weights_data", readJson(rs.getString("weights_data")));
                doc.set("performance_data", readJson(rs.getString("performance_data")));
                log.info("Found legacy quant_memory row for {}", market);
                return Optional.of(new StoredDocument(market, LEGACY_VERSION, doc));
            }
        } catch (SQLException e) {
            // quant_memory only exists in databases carried over from the old engine
            log.debug("No legacy learning table: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static JsonNode readJson(String raw) throws Exception {
        return raw == null ? MAPPER.createObjectNode() : MAPPER.readTree(raw);
    }

    @Override
    public void save(String market, int schemaVersion, JsonNode document) {
        String sql = """
            INSERT INTO learning_memory (market, schema_version, record, updated_at)
            VALUES (?, ?, ?::jsonb, NOW())
            ON CONFLICT (market) DO UPDATE SET
                schema_version = EXCLUDED.schema_version,
                record = EXCLUDED.record,
                updated_at = NOW()
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, market);
            ps.setInt(2, schemaVersion);
            ps.setString(3, MAPPER.writeValueAsString(document));
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Error saving learning memory for {}: {}", market, e.getMessage(), e);
            throw new RuntimeException("Failed to save learning memory", e);
        }
    }

    @Override
    public void delete(String market) {
        String sql = "DELETE FROM learning_memory WHERE market = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, market);
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Error deleting learning memory for {}: {}", market, e.getMessage(), e);
            throw new RuntimeException("Failed to delete learning memory", e);
        }
    }
}
