package com.expirebot.expiry.tracking;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class PostgreSQLTrackedEventStore implements TrackedEventStore {

    private static final Logger log = LoggerFactory.getLogger(PostgreSQLTrackedEventStore.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public PostgreSQLTrackedEventStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean insert(String eventId, String roomId) {
        String sql = """
                INSERT INTO tracked_entry (event_id, room_id)
                SELECT CAST(:eventId AS VARCHAR(255)), p.room_id
                FROM room_policy p
                WHERE p.room_id = :roomId
                  AND NOT EXISTS (SELECT 1 FROM tracked_entry t WHERE t.event_id = :eventId)
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("eventId", eventId)
                .addValue("roomId", roomId);
        try {
            return jdbcTemplate.update(sql, params) > 0;
        } catch (DataIntegrityViolationException ex) {
            // duplicate from a concurrent insert, or the policy was removed in between
            log.debug("Ignoring tracked entry {} in {}: {}", eventId, roomId, ex.getMostSpecificCause().getMessage());
            return false;
        }
    }

    @Override
    public boolean delete(String eventId) {
        return jdbcTemplate.update("DELETE FROM tracked_entry WHERE event_id = :eventId",
                new MapSqlParameterSource("eventId", eventId)) > 0;
    }

    @Override
    public List<TrackedEvent> listExpiryCandidates() {
        String sql = """
                SELECT t.event_id, t.room_id, p.ttl_ms
                FROM tracked_entry t
                JOIN room_policy p ON p.room_id = t.room_id
                ORDER BY t.room_id, t.event_id
                """;
        return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
    }

    @Override
    public long countByRoom(String roomId) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tracked_entry WHERE room_id = :roomId",
                new MapSqlParameterSource("roomId", roomId), Long.class);
        return count != null ? count : 0L;
    }

    private TrackedEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new TrackedEvent(rs.getString("event_id"), rs.getString("room_id"), rs.getLong("ttl_ms"));
    }
}
