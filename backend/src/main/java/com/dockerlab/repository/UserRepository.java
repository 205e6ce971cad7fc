package com.dockerlab.repository;

import com.dockerlab.model.User;
import com.dockerlab.model.UserPatch;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Parameterized access to the {@code users} table.
 * <p>
 * A unique-email violation surfaces as Spring's
 * {@link org.springframework.dao.DuplicateKeyException}.
 */
@Repository
@RequiredArgsConstructor
public class UserRepository {

    private static final String COLUMNS = "id, name, email, created_at, updated_at";

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> User.builder()
        .id(rs.getLong("id"))
        .name(rs.getString("name"))
        .email(rs.getString("email"))
        .createdAt(rs.getObject("created_at", LocalDateTime.class))
        .updatedAt(rs.getObject("updated_at", LocalDateTime.class))
        .build();

    private final NamedParameterJdbcTemplate jdbc;

    public List<User> findAll() {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM users ORDER BY created_at DESC, id DESC",
            ROW_MAPPER);
    }

    public Optional<User> findById(long id) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM users WHERE id = :id",
                new MapSqlParameterSource("id", id),
                ROW_MAPPER)
            .stream()
            .findFirst();
    }

    public User insert(String name, String email) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("email", email);
        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbc.update(
            "INSERT INTO users (name, email) VALUES (:name, :email)",
            params, keyHolder, new String[] {"id"});

        long id = keyHolder.getKeyAs(Number.class).longValue();
        return findById(id)
            .orElseThrow(() -> new IllegalStateException("Inserted user " + id + " is not readable"));
    }

    /**
     * Applies the supplied fields of {@code patch} in one statement and refreshes
     * {@code updated_at}. Empty when no user has that id.
     */
    public Optional<User> update(long id, UserPatch patch) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("name", patch.name().orElse(null), Types.VARCHAR)
            .addValue("email", patch.email().orElse(null), Types.VARCHAR);

        int updated = jdbc.update(
            "UPDATE users SET "
                + "name = COALESCE(:name, name), "
                + "email = COALESCE(:email, email), "
                + "updated_at = CURRENT_TIMESTAMP "
                + "WHERE id = :id",
            params);

        return updated == 0 ? Optional.empty() : findById(id);
    }

    /**
     * Removes the user and returns the row as it was. Empty when no user has that id,
     * including when a concurrent delete removed it after it was read.
     */
    public Optional<User> deleteById(long id) {
        Optional<User> existing = findById(id);
        if (existing.isEmpty()) {
            return existing;
        }

        int deleted = jdbc.update(
            "DELETE FROM users WHERE id = :id",
            new MapSqlParameterSource("id", id));
        return deleted == 0 ? Optional.empty() : existing;
    }
}
