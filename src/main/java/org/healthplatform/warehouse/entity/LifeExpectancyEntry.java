package org.healthplatform.warehouse.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA Entity for the health_life_expectancy table.
 * Read-only view of loaded batches; rows are written by the bulk loader, never through JPA.
 * The table has no surrogate key, so the batch-unique natural key plus the batch stamp is the identity.
 */
@Entity
@Table(name = "health_life_expectancy")
@IdClass(LifeExpectancyEntryId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifeExpectancyEntry {

    @Column(name = "country_name")
    private String countryName;

    @Id
    @Column(name = "country_code")
    private String countryCode;

    @Id
    @Column(name = "year")
    private Integer year;

    @Id
    @Column(name = "sex")
    private String sex;

    @Column(name = "life_expectancy")
    private Double lifeExpectancy;

    @Id
    @Column(name = "ingested_at")
    private LocalDateTime ingestedAt;
}
