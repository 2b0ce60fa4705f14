package com.warehouseanalytics.analysis.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.warehouseanalytics.common.engine.AnalyticsEngine;
import com.warehouseanalytics.common.forecast.NoiseSource;
import com.warehouseanalytics.common.model.AnalyticsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.function.Supplier;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsEngineConfig.class);

    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }

    @Bean
    public AnalyticsConfig defaultAnalyticsConfig(AnalyticsProperties properties) {
        AnalyticsConfig config = properties.defaults().toConfig();
        log.info("[Analytics] Default config timeWindow={} sensitivity={} forecasting={} anomalyDetection={} "
                 + "patternRecognition={} forecastPeriods={}",
                 config.timeWindow().code(), config.sensitivity().code(), config.enableForecasting(),
                 config.enableAnomalyDetection(), config.enablePatternRecognition(), config.forecastPeriods());
        return config;
    }

    @Bean
    public AnalyticsEngine analyticsEngine(Clock analyticsClock, AnalyticsProperties properties) {
        AnalyticsProperties.Forecast forecast = properties.forecast();
        Supplier<NoiseSource> noiseFactory;
        if (forecast.seeded()) {
            long seed = forecast.seed();
            noiseFactory = () -> NoiseSource.seeded(seed);
            log.info("[Analytics] Forecast noise seeded. seed={}", seed);
        } else {
            noiseFactory = NoiseSource::random;
        }
        return new AnalyticsEngine(analyticsClock, noiseFactory);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
