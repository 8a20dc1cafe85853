package com.skyport.panel.api.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcKeyValueStore implements KeyValueStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcKeyValueStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        List<String> rows = jdbcTemplate.queryForList("""
                        select entry_value
                        from kv_entry
                        where entry_key = ?
                        """,
                String.class,
                key
        );
        return rows.stream().findFirst();
    }

    @Override
    @Transactional
    public void set(String key, String json) {
        Timestamp now = Timestamp.from(Instant.now());
        int updated = jdbcTemplate.update("""
                        update kv_entry
                        set entry_value = ?, updated_at = ?
                        where entry_key = ?
                        """,
                json,
                now,
                key
        );
        if (updated == 0) {
            jdbcTemplate.update("""
                            insert into kv_entry
                            (entry_key, entry_value, updated_at)
                            values (?, ?, ?)
                            """,
                    key,
                    json,
                    now
            );
        }
    }
}
