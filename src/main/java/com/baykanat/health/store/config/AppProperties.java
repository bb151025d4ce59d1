package com.baykanat.health.store.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** app.* için tip güvenli configuration (store kökü, sorgu varsayılanları, saat dilimi). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private StorageProperties storage = new StorageProperties();
    private QueryProperties query = new QueryProperties();
    private ReaderProperties reader = new ReaderProperties();
    /** "Bugün" ve processed_at için saat dilimi; boşsa sistem varsayılanı. */
    private String timeZone;

    @Getter
    @Setter
    public static class StorageProperties {
        /** year=/month=/day= dizinlerinin kökü. */
        private String root = "data";
        /** Part dosyaları için Parquet sıkıştırma codec'i. */
        private String compression = "SNAPPY";
    }

    @Getter
    @Setter
    public static class QueryProperties {
        /** DuckDB read_parquet glob'u; boşsa storage.root'tan türetilir. */
        private String dataGlob;
        private int defaultLimit = 200;
        private int defaultDays = 30;
        private int recentLimit = 100;
    }

    @Getter
    @Setter
    public static class ReaderProperties {
        private int defaultLimit = 100;
    }
}
