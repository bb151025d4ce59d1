package com.baykanat.health.store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Uygulama giriş noktası; Parquet event store ve DuckDB sorgu katmanı. */
@SpringBootApplication
public class HealthStoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(HealthStoreApplication.class, args);
	}

}
