package com.reviewroster.scheduler.common.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.reviewer.status-reset")
public record StatusResetProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("7") @Min(0) int timeoutDays
) {
}
