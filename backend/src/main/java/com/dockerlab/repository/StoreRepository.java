package com.dockerlab.repository;

import com.dockerlab.model.StoreCounts;
import com.dockerlab.model.StoreProbe;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;

/**
 * Queries about the store itself rather than its tables' business content.
 */
@Repository
@RequiredArgsConstructor
public class StoreRepository {

    private final JdbcTemplate jdbc;

    /**
     * Round trip through the pool. Throws a {@link org.springframework.dao.DataAccessException}
     * when the store cannot be reached.
     */
    public void ping() {
        jdbc.queryForObject("SELECT 1", Integer.class);
    }

    public StoreProbe probe() {
        return jdbc.execute((ConnectionCallback<StoreProbe>) connection -> {
            String version = describe(connection.getMetaData());

            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT CURRENT_TIMESTAMP")) {
                rs.next();
                return new StoreProbe(rs.getObject(1, OffsetDateTime.class), version);
            }
        });
    }

    public String version() {
        return jdbc.execute((ConnectionCallback<String>) connection -> describe(connection.getMetaData()));
    }

    private static String describe(DatabaseMetaData metaData) throws SQLException {
        return metaData.getDatabaseProductName() + " " + metaData.getDatabaseProductVersion();
    }

    public StoreCounts counts() {
        return jdbc.queryForObject(
            "SELECT "
                + "(SELECT COUNT(*) FROM users) AS users, "
                + "(SELECT COUNT(*) FROM products) AS products, "
                + "(SELECT COALESCE(SUM(stock), 0) FROM products) AS total_stock",
            (rs, rowNum) -> new StoreCounts(
                rs.getLong("users"),
                rs.getLong("products"),
                rs.getLong("total_stock")));
    }
}
