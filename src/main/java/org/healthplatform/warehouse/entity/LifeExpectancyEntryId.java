package org.healthplatform.warehouse.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LifeExpectancyEntryId implements Serializable {

    private String countryCode;
    private Integer year;
    private String sex;
    private LocalDateTime ingestedAt;
}
