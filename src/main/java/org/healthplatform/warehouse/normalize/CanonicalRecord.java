package org.healthplatform.warehouse.normalize;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One warehouse row. Field order follows {@link #COLUMNS}, which is the declared column order
 * of the target table.
 */
@Value
@Builder
public class CanonicalRecord {

    public static final List<String> COLUMNS = List.of(
        "country_name", "country_code", "year", "sex", "life_expectancy", "ingested_at");

    String countryName;
    String countryCode;
    int year;
    SexCategory sex;
    double lifeExpectancy;
    /** UTC start time of the run that produced the row. */
    LocalDateTime ingestedAt;
}
