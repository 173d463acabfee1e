package com.anthem.billtriage.repository;

import com.anthem.billtriage.model.AssignmentResult;
import com.anthem.billtriage.model.RateUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

/**
 * Persists applied rate assignments.
 *
 * {@code rate_assignment.filename} is the primary key, so a second assignment for the same bill
 * fails with {@link org.springframework.dao.DuplicateKeyException}.
 */
@Repository
public class RateAssignmentRepository {

    private static final String INSERT_ASSIGNMENT = """
            INSERT INTO rate_assignment (filename, mode, update_count, category_summary, unresolved_codes, applied_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_RATE = """
            INSERT INTO assigned_rate (filename, procedure_code, modifier, rate, category)
            VALUES (?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public RateAssignmentRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Insert the assignment header and one row per update. Callers run this inside a transaction.
     */
    public void save(AssignmentResult result) {
        jdbcTemplate.update(INSERT_ASSIGNMENT,
                result.getFilename(),
                result.getMode().getValue(),
                result.getUpdatedRates().size(),
                result.getCategorySummary() != null ? toJson(result.getCategorySummary()) : null,
                String.join(",", result.getUnresolvedCodes()),
                Timestamp.from(result.getAppliedAt()));

        List<RateUpdate> updates = result.getUpdatedRates();
        if (updates.isEmpty()) {
            return;
        }
        List<Object[]> rows = updates.stream()
                .map(u -> new Object[]{
                        result.getFilename(),
                        u.getProcedureCode(),
                        u.getModifier() != null ? u.getModifier() : "",
                        u.getRate(),
                        u.getCategory()})
                .toList();
        jdbcTemplate.batchUpdate(INSERT_RATE, rows);
    }

    public boolean exists(String filename) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM rate_assignment WHERE filename = ?", Integer.class, filename);
        return count != null && count > 0;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize category summary", e);
        }
    }
}
