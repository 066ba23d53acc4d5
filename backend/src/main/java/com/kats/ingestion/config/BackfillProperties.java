package com.kats.ingestion.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Historical backfill settings.
 */
@ConfigurationProperties(prefix = "kats.backfill")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class BackfillProperties {

    /** Transactions per page of the full listing. Krist caps limit at 1000. */
    @Min(1)
    @Max(1000)
    private int pageSize = 1000;
}
