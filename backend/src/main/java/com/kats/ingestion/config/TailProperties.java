package com.kats.ingestion.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tail settings: latest-listing page size, timer period and dispatcher backlog.
 */
@ConfigurationProperties(prefix = "kats.tail")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class TailProperties {

    /** Transactions per page of the latest listing. */
    @Min(1)
    @Max(1000)
    private int pageSize = 10;

    /** Delay between timer-driven tail triggers. */
    private long intervalMs = 1_000;

    /**
     * Triggers are dropped once pending + running runs exceed this depth.
     * 1 means at most one run executing and one queued behind it.
     */
    @Min(1)
    private int maxQueueDepth = 1;
}
