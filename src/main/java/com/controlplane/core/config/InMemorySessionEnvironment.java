package com.controlplane.core.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Turns off Boot's datasource auto-configuration when sessions are kept in memory, i.e. in eval
 * mode or when no {@code spring.datasource.url} is set. Without this Boot fails at startup trying
 * to build a pool with no URL.
 */
public class InMemorySessionEnvironment implements EnvironmentPostProcessor {

    static final String EVAL_MODE = "controlplane.session.eval-mode";
    static final String DATASOURCE_URL = "spring.datasource.url";
    static final String EXCLUDE = "spring.autoconfigure.exclude";
    static final String DATASOURCE_AUTO_CONFIGURATION =
            "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        boolean evalMode = environment.getProperty(EVAL_MODE, Boolean.class, false);
        if (!evalMode && StringUtils.hasText(environment.getProperty(DATASOURCE_URL))) {
            return;
        }
        String existing = environment.getProperty(EXCLUDE, "");
        String exclude = existing.isBlank() ? DATASOURCE_AUTO_CONFIGURATION : existing + "," + DATASOURCE_AUTO_CONFIGURATION;
        environment.getPropertySources().addFirst(
                new MapPropertySource("controlplaneInMemorySessions", Map.of(EXCLUDE, exclude)));
    }
}
