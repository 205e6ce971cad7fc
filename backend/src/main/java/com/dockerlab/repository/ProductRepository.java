package com.dockerlab.repository;

import com.dockerlab.model.Product;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class ProductRepository {

    private static final RowMapper<Product> ROW_MAPPER = (rs, rowNum) -> Product.builder()
        .id(rs.getLong("id"))
        .name(rs.getString("name"))
        .price(rs.getBigDecimal("price"))
        .stock(rs.getInt("stock"))
        .createdAt(rs.getObject("created_at", LocalDateTime.class))
        .build();

    private final JdbcTemplate jdbc;

    public List<Product> findAll() {
        return jdbc.query(
            "SELECT id, name, price, stock, created_at FROM products ORDER BY created_at DESC, id DESC",
            ROW_MAPPER);
    }
}
