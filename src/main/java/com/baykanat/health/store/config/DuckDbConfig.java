package com.baykanat.health.store.config;

import org.duckdb.DuckDBDriver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;

import javax.sql.DataSource;

/**
 * DuckDB DataSource'u. Havuz yok: her getConnection yeni, boş bir in-memory veritabanı açar ve
 * bağlantı kapanınca veritabanı da gider. Bir sorgunun SET/CREATE etkisi sonraki çağrıya taşınmaz.
 */
@Configuration
public class DuckDbConfig {

    public static final String IN_MEMORY_URL = "jdbc:duckdb:";

    @Bean
    public DataSource dataSource() {
        return inMemoryDataSource();
    }

    public static DataSource inMemoryDataSource() {
        return new SimpleDriverDataSource(new DuckDBDriver(), IN_MEMORY_URL);
    }
}
