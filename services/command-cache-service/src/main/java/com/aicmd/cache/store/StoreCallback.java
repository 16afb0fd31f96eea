package com.aicmd.cache.store;

import org.springframework.jdbc.core.JdbcTemplate;

@FunctionalInterface
public interface StoreCallback<T> {
    T doInStore(JdbcTemplate jdbcTemplate);
}
