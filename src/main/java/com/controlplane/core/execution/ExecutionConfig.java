package com.controlplane.core.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback {@link ActionInvoker} for deployments that have not wired a tool provider.
 */
@Configuration
public class ExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutionConfig.class);

    @Bean
    @ConditionalOnMissingBean(ActionInvoker.class)
    public ActionInvoker unconfiguredActionInvoker() {
        log.info("No ActionInvoker configured; action execution will fail until a tool provider is wired");
        return (action, context) -> {
            throw new ToolExecutionException("No tool provider configured for toolkit " + action.toolkit(), null);
        };
    }
}
