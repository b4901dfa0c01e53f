package com.switchboard.core.verification;

import com.switchboard.core.model.EnvironmentFacts;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EnvironmentInspectorConfig {

    /** No sandbox: entity checks are skipped and the behavioral stage reports no simulation. */
    @Bean
    @ConditionalOnMissingBean(EnvironmentInspector.class)
    public EnvironmentInspector noEnvironmentInspector() {
        return (operation, action) -> EnvironmentFacts.none();
    }
}
