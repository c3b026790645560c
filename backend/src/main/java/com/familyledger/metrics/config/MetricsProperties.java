package com.familyledger.metrics.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Metrics configuration. Documented in application.yml under familyledger.metrics.
 */
@ConfigurationProperties(prefix = "familyledger.metrics")
@NoArgsConstructor
@Getter
@Setter
public class MetricsProperties {

    /**
     * Rupiah per gram used to value gold holdings in the wealth estimate. A fixed rough figure, not a price feed.
     */
    private BigDecimal goldPricePerGram = new BigDecimal("900000");
}
