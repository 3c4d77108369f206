package com.example.jobscheduler.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the http-callback job handler
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler.http-callback")
public class HttpCallbackProperties {

    @Min(1)
    private int connectTimeoutSeconds = 10;

    @Min(1)
    private int responseTimeoutSeconds = 30;

    /**
     * Value of the X-Service-Name header sent with every callback
     */
    private String serviceName = "job-scheduler";
}
