package com.baykanat.health.store.domain.model;

import lombok.Value;

import java.time.LocalDate;

/** year=YYYY/month=MM/day=DD partition anahtarı; sıfır dolgulu, sözlük sırası = kronolojik sıra. */
@Value
public class PartitionKey {

    int year;
    int month;
    int day;

    public static PartitionKey of(LocalDate date) {
        return new PartitionKey(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /** Store köküne göre göreli dizin yolu. */
    public String path() {
        return String.format("year=%04d/month=%02d/day=%02d", year, month, day);
    }

    public LocalDate toDate() {
        return LocalDate.of(year, month, day);
    }

    @Override
    public String toString() {
        return path();
    }
}
