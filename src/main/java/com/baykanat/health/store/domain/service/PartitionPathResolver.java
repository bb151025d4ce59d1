package com.baykanat.health.store.domain.service;

import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.domain.model.PartitionKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Takvim tarihi → year=YYYY/month=MM/day=DD partition anahtarı. Tarih verilmezse Clock'tan bugün. */
@Component
@RequiredArgsConstructor
public class PartitionPathResolver {

    static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern KEY_PATTERN =
            Pattern.compile("year=(\\d{4})/month=(\\d{2})/day=(\\d{2})");

    private final Clock clock;

    public PartitionKey resolve(LocalDate date) {
        return PartitionKey.of(date != null ? date : today());
    }

    /** YYYY-MM-DD; null/boş ise bugün. Geçersiz tarih MALFORMED_DATE. */
    public PartitionKey resolve(String date) {
        if (date == null || date.isBlank()) {
            return resolve(today());
        }
        return PartitionKey.of(parseDate(date));
    }

    /**
     * Partition yolundan tarihi geri kurar (sondaki dosya adı vb. yok sayılır).
     * Üretim kodu çağırmaz; anahtarın tarihe kayıpsız döndüğü bu metot üzerinden doğrulanır.
     */
    public PartitionKey fromPath(String path) {
        Matcher matcher = KEY_PATTERN.matcher(path.replace('\\', '/'));
        if (!matcher.find()) {
            throw HealthStoreException.malformedDate(path);
        }
        try {
            LocalDate date = LocalDate.of(Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(3)));
            return PartitionKey.of(date);
        } catch (DateTimeException e) {
            throw HealthStoreException.malformedDate(path);
        }
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    static LocalDate parseDate(String date) {
        try {
            return LocalDate.parse(date.trim(), DATE_FORMAT);
        } catch (DateTimeException e) {
            throw HealthStoreException.malformedDate(date);
        }
    }
}
