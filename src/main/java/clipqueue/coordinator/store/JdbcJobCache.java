package clipqueue.coordinator.store;

import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores the whole job list as one JSON document under a fixed key.
 * Unreadable or unknown-version payloads load as empty.
 */
public class JdbcJobCache implements JobCache {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobCache.class);

    private final Database db;
    private final String cacheKey;

    public JdbcJobCache(Database db, String cacheKey) {
        this.db = db;
        this.cacheKey = cacheKey;
    }

    @Override
    public List<Job> load() {
        String payload = readPayload();
        if (payload == null) {
            return List.of();
        }
        try {
            CacheEnvelope envelope = Json.mapper().readValue(payload, CacheEnvelope.class);
            if (envelope.version() != CacheEnvelope.CURRENT_VERSION) {
                log.warn("Ignoring cached jobs with unsupported version {}", envelope.version());
                return List.of();
            }
            if (envelope.jobs() == null) {
                return List.of();
            }
            List<Job> jobs = new ArrayList<>(envelope.jobs().size());
            for (JobSnapshot snapshot : envelope.jobs()) {
                jobs.add(snapshot.toJob());
            }
            log.info("Loaded {} cached jobs", jobs.size());
            return jobs;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Cached jobs under '{}' are unreadable, starting empty: {}", cacheKey, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void save(List<Job> jobs) {
        String payload;
        try {
            payload = Json.mapper().writeValueAsString(
                    CacheEnvelope.of(jobs.stream().map(JobSnapshot::from).toList()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize jobs", e);
        }

        String deleteSql = "DELETE FROM cache_entries WHERE cache_key = ?";
        String insertSql = "INSERT INTO cache_entries (cache_key, payload, updated_at) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement del = conn.prepareStatement(deleteSql);
                    PreparedStatement ins = conn.prepareStatement(insertSql)) {
                del.setString(1, cacheKey);
                del.executeUpdate();

                ins.setString(1, cacheKey);
                ins.setString(2, payload);
                ins.setTimestamp(3, Timestamp.from(Instant.now()));
                ins.executeUpdate();

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save jobs under " + cacheKey, e);
        }
    }

    /** Remove the stored document. */
    public void clear() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM cache_entries WHERE cache_key = ?")) {
            ps.setString(1, cacheKey);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to clear " + cacheKey, e);
        }
    }

    private String readPayload() {
        String sql = "SELECT payload FROM cache_entries WHERE cache_key = ?";
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, cacheKey);
            try (ResultSet rs = ps.executeQuery()) {
                String payload = rs.next() ? rs.getString("payload") : null;
                conn.commit();
                return payload;
            }
        } catch (SQLException e) {
            log.warn("Failed to read cached jobs: {}", e.getMessage());
            return null;
        }
    }
}
