package com.bastion.database.user;

import com.bastion.security.DuplicateEmailException;
import com.bastion.security.User;
import com.bastion.security.UserDirectory;
import com.bastion.security.UserField;
import com.bastion.security.UserFilter;
import com.bastion.security.UserNotFoundException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link UserDirectory} stored in the {@code users} table.
 *
 * <p>Every call borrows a connection from the {@link DataSource} and releases it before
 * returning. Inserts and updates run in their own transaction and touch a single row.
 * Email uniqueness is checked before insert and enforced by the {@code uq_users_email}
 * constraint; a constraint violation from a concurrent insert is reported as
 * {@link DuplicateEmailException} as well.
 */
public class JdbcUserDirectory implements UserDirectory {

    private static final Logger log = LoggerFactory.getLogger(JdbcUserDirectory.class);

    private static final String SELECT_USERS =
            "SELECT id, email, hashed_password, session_id, reset_token FROM users";

    private static final String INSERT_USER =
            "INSERT INTO users (email, hashed_password) VALUES (:email, :hashedPassword)";

    private static final RowMapper<User> USER_ROW_MAPPER =
            (rs, rowNum) ->
                    new User(
                            rs.getLong("id"),
                            rs.getString("email"),
                            rs.getString("hashed_password"),
                            rs.getString("session_id"),
                            rs.getString("reset_token"));

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public JdbcUserDirectory(DataSource dataSource, PlatformTransactionManager transactionManager) {
        this.jdbc = new NamedParameterJdbcTemplate(Objects.requireNonNull(dataSource, "dataSource"));
        this.transactions =
                new TransactionTemplate(Objects.requireNonNull(transactionManager, "transactionManager"));
    }

    @Override
    public List<User> lookup(UserFilter filter) {
        Objects.requireNonNull(filter, "filter");
        List<String> conditions = new ArrayList<>();
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (filter.email() != null) {
            conditions.add("email = :email");
            params.addValue("email", filter.email());
        }
        if (filter.id() != null) {
            conditions.add("id = :id");
            params.addValue("id", filter.id());
        }
        if (filter.resetToken() != null) {
            conditions.add("reset_token = :resetToken");
            params.addValue("resetToken", filter.resetToken());
        }
        String sql = SELECT_USERS + " WHERE " + String.join(" AND ", conditions) + " ORDER BY id";
        return jdbc.query(sql, params, USER_ROW_MAPPER);
    }

    @Override
    public User insert(String email, String passwordDigest) {
        if (email == null || passwordDigest == null) {
            throw new IllegalArgumentException("email and passwordDigest must not be null");
        }
        try {
            User user =
                    transactions.execute(
                            status -> {
                                if (findOne(UserFilter.byEmail(email)).isPresent()) {
                                    throw new DuplicateEmailException(email);
                                }
                                KeyHolder keys = new GeneratedKeyHolder();
                                jdbc.update(
                                        INSERT_USER,
                                        new MapSqlParameterSource()
                                                .addValue("email", email)
                                                .addValue("hashedPassword", passwordDigest),
                                        keys,
                                        new String[] {"id"});
                                long id = Objects.requireNonNull(keys.getKey(), "generated id").longValue();
                                return new User(id, email, passwordDigest, null, null);
                            });
            log.debug("Inserted user {}", user.id());
            return user;
        } catch (DuplicateKeyException e) {
            throw new DuplicateEmailException(email, e);
        }
    }

    @Override
    public void update(long id, Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        Map<UserField, Object> resolved = new LinkedHashMap<>();
        fields.forEach((name, value) -> resolved.put(UserField.require(name), value));

        if (resolved.isEmpty()) {
            if (findOne(UserFilter.byId(id)).isEmpty()) {
                throw UserNotFoundException.forId(id);
            }
            return;
        }

        List<String> assignments = new ArrayList<>();
        MapSqlParameterSource params = new MapSqlParameterSource("id", id);
        for (Map.Entry<UserField, Object> entry : resolved.entrySet()) {
            UserField field = entry.getKey();
            Object value = entry.getValue();
            if (value == null && (field == UserField.EMAIL || field == UserField.PASSWORD_DIGEST)) {
                throw new IllegalArgumentException(field.fieldName() + " must not be null");
            }
            assignments.add(field.column() + " = :" + field.column());
            params.addValue(field.column(), value == null ? null : value.toString());
        }
        String sql = "UPDATE users SET " + String.join(", ", assignments) + " WHERE id = :id";

        try {
            transactions.executeWithoutResult(
                    status -> {
                        if (jdbc.update(sql, params) == 0) {
                            throw UserNotFoundException.forId(id);
                        }
                    });
        } catch (DuplicateKeyException e) {
            throw new DuplicateEmailException(String.valueOf(resolved.get(UserField.EMAIL)), e);
        }
        log.debug("Updated user {} fields {}", id, fields.keySet());
    }
}
