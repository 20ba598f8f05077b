package in.digitflow.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.digitflow.domain.repository.ActivityLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Appends to {@code trading_activity_logs}; the message is stored inside {@code action_details}.
 */
public final class PostgresActivityLogRepository implements ActivityLogRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresActivityLogRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public PostgresActivityLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void append(String sessionId, String type, String message, JsonNode metadata) {
        String sql = """
            INSERT INTO trading_activity_logs (session_id, action_type, action_details)
            VALUES (?::uuid, ?, ?::jsonb)
            """;

        ObjectNode details = MAPPER.createObjectNode();
        if (metadata != null && metadata.isObject()) {
            details.setAll((ObjectNode) metadata);
        }
        details.put("message", message);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sessionId);
            ps.setString(2, type);
            ps.setString(3, details.toString());
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Error appending activity {} for session {}: {}", type, sessionId, e.getMessage(), e);
            throw new RuntimeException("Failed to append activity log", e);
        }
    }
}
