package com.mailflow.infrastructure.config;

import com.mailflow.application.service.WatchPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MailflowConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WatchPolicy watchPolicy(AppProperties appProperties) {
        AppProperties.Watch watch = appProperties.getWatch();
        return new WatchPolicy(
            watch.getServiceType(),
            appProperties.getSubscription().getApplicationName(),
            watch.getDefaultLabels(),
            watch.getSafetyMargin(),
            watch.getRenewalThreshold(),
            watch.getRetryBackoff(),
            watch.getMinimumDelay(),
            watch.getDefaultExpiration(),
            watch.getStopTimeout(),
            appProperties.getSubscription().isForceNewWatch()
        );
    }
}
