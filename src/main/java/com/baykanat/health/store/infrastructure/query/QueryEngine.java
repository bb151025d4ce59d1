package com.baykanat.health.store.infrastructure.query;

import com.baykanat.health.store.api.dto.QueryResultResponse;
import com.baykanat.health.store.config.AppProperties;
import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.infrastructure.storage.StorageLayout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tüm partition dosyalarını glob ile tek ilişki olarak DuckDB'ye bağlar ve sorgular.
 * health_data ve health_data_norm (ts, partition_date) view'ları her çağrıda aynı bağlantıda yeniden kurulur.
 */
@Slf4j
@Repository
public class QueryEngine {

    private static final String RELATION = "health_data";

    private static final String EMPTY_VIEW = """
            CREATE OR REPLACE TEMP VIEW health_data AS
            SELECT CAST(NULL AS VARCHAR) AS "timestamp",
                   CAST(NULL AS BIGINT) AS year,
                   CAST(NULL AS BIGINT) AS month,
                   CAST(NULL AS BIGINT) AS day
            WHERE false
            """;

    private static final String NORMALIZED_VIEW = """
            CREATE OR REPLACE TEMP VIEW health_data_norm AS
            SELECT *,
                   TRY_CAST("timestamp" AS TIMESTAMPTZ) AS ts,
                   make_date(CAST(year AS BIGINT), CAST(month AS BIGINT), CAST(day AS BIGINT)) AS partition_date
            FROM health_data
            """;

    private static final String DAILY_AGG_SQL = """
            SELECT partition_date AS date,
                   SUM(%s) AS steps,
                   SUM(%s) AS kcal,
                   SUM(%s) AS meters,
                   SUM(%s) AS mindful_min,
                   SUM(%s) AS sleep_min
            FROM health_data_norm
            WHERE partition_date >= CAST(? AS DATE)
            GROUP BY 1
            ORDER BY 1
            """;

    private static final String RECENT_RAW_SQL = """
            SELECT *
            FROM health_data_norm
            WHERE partition_date = CAST(? AS DATE)
            ORDER BY ts
            LIMIT %d
            """;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final String dataGlob;

    public QueryEngine(JdbcTemplate jdbcTemplate, Clock clock, AppProperties appProperties, StorageLayout layout) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        String configured = appProperties.getQuery().getDataGlob();
        this.dataGlob = configured != null && !configured.isBlank() ? configured : layout.defaultGlob();
    }

    /** Kullanıcı SQL'i çalışır; sonuç sorgudan sonra ilk {@code limit} satıra kesilir. */
    public QueryResultResponse runSql(String sql, int limit) {
        log.debug("Running ad-hoc SQL (limit={}): {}", limit, sql);
        return withRelation((con, columns) -> {
            try (Statement statement = con.createStatement()) {
                if (!statement.execute(sql)) {
                    return QueryResultResponse.of(List.of());
                }
                try (ResultSet rs = statement.getResultSet()) {
                    return QueryResultResponse.of(extract(rs, limit));
                }
            }
        });
    }

    /** Bugün - days ve sonrası; ölçüm sütunu hiçbir dosyada yoksa NULL toplanır. */
    public QueryResultResponse dailyAggregate(int days) {
        LocalDate from = LocalDate.now(clock).minusDays(days);
        log.info("daily_agg: days={}, from={}", days, from);
        return withRelation((con, columns) -> {
            String sql = String.format(DAILY_AGG_SQL,
                    measure(columns, "stepCount"),
                    measure(columns, "activeEnergyBurned"),
                    measure(columns, "distanceWalkingRunning"),
                    measure(columns, "mindfulMinutes"),
                    measure(columns, "totalSleepMinutes"));
            try (PreparedStatement ps = con.prepareStatement(sql)) {
                ps.setString(1, from.toString());
                try (ResultSet rs = ps.executeQuery()) {
                    return QueryResultResponse.of(extract(rs, Integer.MAX_VALUE));
                }
            }
        });
    }

    /** Bugünün ham kayıtları, ts artan (en eski önce). */
    public QueryResultResponse recentRaw(int limit) {
        LocalDate today = LocalDate.now(clock);
        log.info("recent_raw: date={}, limit={}", today, limit);
        return withRelation((con, columns) -> {
            try (PreparedStatement ps = con.prepareStatement(String.format(RECENT_RAW_SQL, limit))) {
                ps.setString(1, today.toString());
                try (ResultSet rs = ps.executeQuery()) {
                    return QueryResultResponse.of(extract(rs, limit));
                }
            }
        });
    }

    /**
     * View'ları kurar ve callback'i aynı bağlantıda çalıştırır; SQL hataları QUERY_EXECUTION_FAILED.
     * Bağlantı çağrı sonunda kapanır; DuckDbConfig ile her çağrı kendi in-memory veritabanını alır.
     */
    private <T> T withRelation(RelationCallback<T> callback) {
        try {
            return jdbcTemplate.execute((ConnectionCallback<T>) con -> {
                Set<String> columns = registerViews(con);
                return callback.doWithRelation(con, columns);
            });
        } catch (DataAccessException e) {
            Throwable cause = e.getMostSpecificCause();
            throw new HealthStoreException(ErrorCode.QUERY_EXECUTION_FAILED,
                    "Query failed: " + cause.getMessage(), e);
        }
    }

    private Set<String> registerViews(Connection con) throws SQLException {
        try (Statement statement = con.createStatement()) {
            if (hasDataFiles(statement)) {
                statement.execute("CREATE OR REPLACE TEMP VIEW health_data AS SELECT * FROM read_parquet("
                        + quote(dataGlob) + ", hive_partitioning = true, union_by_name = true)");
            } else {
                statement.execute(EMPTY_VIEW);
            }
            statement.execute(NORMALIZED_VIEW);

            Set<String> columns = new HashSet<>();
            try (ResultSet rs = statement.executeQuery("DESCRIBE " + RELATION)) {
                while (rs.next()) {
                    columns.add(rs.getString("column_name").toLowerCase(Locale.ROOT));
                }
            }
            return columns;
        }
    }

    /** read_parquet eşleşmeyen glob'da hata verir; boş store boş ilişki olmalı. */
    private boolean hasDataFiles(Statement statement) throws SQLException {
        try (ResultSet rs = statement.executeQuery("SELECT count(*) FROM glob(" + quote(dataGlob) + ")")) {
            return rs.next() && rs.getLong(1) > 0;
        }
    }

    private static String measure(Set<String> columns, String column) {
        return columns.contains(column.toLowerCase(Locale.ROOT))
                ? "\"" + column + "\""
                : "CAST(NULL AS DOUBLE)";
    }

    private static String quote(String literal) {
        return "'" + literal.replace("'", "''") + "'";
    }

    private static List<Map<String, Object>> extract(ResultSet rs, int limit) throws SQLException {
        ColumnMapRowMapper mapper = new ColumnMapRowMapper();
        List<Map<String, Object>> rows = new ArrayList<>();
        int rowNum = 0;
        while (rows.size() < limit && rs.next()) {
            rows.add(JdbcValues.normalizeRow(mapper.mapRow(rs, rowNum++)));
        }
        return rows;
    }

    @FunctionalInterface
    private interface RelationCallback<T> {
        T doWithRelation(Connection con, Set<String> columns) throws SQLException;
    }
}
