package com.expirebot.expiry.policy;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class PostgreSQLRoomPolicyStore implements RoomPolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PostgreSQLRoomPolicyStore.class);

    private static final String UPDATE_TTL = """
            UPDATE room_policy SET ttl_ms = :ttlMs WHERE room_id = :roomId
            """;

    private static final String INSERT = """
            INSERT INTO room_policy (room_id, ttl_ms) VALUES (:roomId, :ttlMs)
            """;

    private final JpaRoomPolicyRepository jpaRoomPolicyRepository;
    private final NamedParameterJdbcTemplate jdbcTemplate;

    public PostgreSQLRoomPolicyStore(JpaRoomPolicyRepository jpaRoomPolicyRepository,
                                     NamedParameterJdbcTemplate jdbcTemplate) {
        this.jpaRoomPolicyRepository = jpaRoomPolicyRepository;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void upsert(String roomId, long ttlMs) {
        requirePositive(ttlMs);
        MapSqlParameterSource params = params(roomId, ttlMs);
        if (jdbcTemplate.update(UPDATE_TTL, params) > 0) {
            return;
        }
        try {
            jdbcTemplate.update(INSERT, params);
        } catch (DuplicateKeyException ex) {
            // another writer created the row between our update and insert; apply ours on top of it
            log.debug("Concurrent insert of policy for {}, applying as update", roomId);
            jdbcTemplate.update(UPDATE_TTL, params);
        }
    }

    @Override
    public boolean createIfAbsent(String roomId, long ttlMs) {
        requirePositive(ttlMs);
        try {
            return jdbcTemplate.update(INSERT, params(roomId, ttlMs)) > 0;
        } catch (DuplicateKeyException ex) {
            return false;
        }
    }

    @Override
    @Transactional
    public boolean delete(String roomId) {
        return jpaRoomPolicyRepository.deleteByRoomId(roomId) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Long> get(String roomId) {
        return jpaRoomPolicyRepository.findById(roomId).map(RoomPolicyEntity::getTtlMs);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RoomPolicy> list() {
        return jpaRoomPolicyRepository.findAllByOrderByRoomIdAsc().stream()
                .map(RoomPolicyEntity::toModel)
                .toList();
    }

    private static MapSqlParameterSource params(String roomId, long ttlMs) {
        return new MapSqlParameterSource()
                .addValue("roomId", roomId)
                .addValue("ttlMs", ttlMs);
    }

    private static void requirePositive(long ttlMs) {
        if (ttlMs <= 0) {
            throw new InvalidDataAccessApiUsageException("ttlMs must be positive");
        }
    }
}
