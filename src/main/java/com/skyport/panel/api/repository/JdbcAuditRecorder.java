package com.skyport.panel.api.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyport.panel.api.model.AuditEvent;
import com.skyport.panel.api.service.AuditRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.UUID;

@Repository
public class JdbcAuditRecorder implements AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditRecorder.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcAuditRecorder(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(AuditEvent event) {
        try {
            jdbcTemplate.update("""
                            insert into audit_log
                            (id, user_id, username, action, ip_address, metadata, created_at)
                            values (?, ?, ?, ?, ?, ?, ?)
                            """,
                    UUID.randomUUID(),
                    event.userId(),
                    event.username(),
                    event.action().tag(),
                    event.ipAddress(),
                    objectMapper.writeValueAsString(event.metadata()),
                    Timestamp.from(event.occurredAt())
            );
        } catch (JsonProcessingException | DataAccessException ex) {
            log.warn("Failed to record audit event {} for user {}: {}", event.action().tag(), event.userId(), ex.getMessage());
        }
    }
}
