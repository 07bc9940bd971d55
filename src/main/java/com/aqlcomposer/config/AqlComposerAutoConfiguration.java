package com.aqlcomposer.config;

import com.aqlcomposer.query.AqlCompiler;
import com.aqlcomposer.query.AqlLiteralSerializer;
import com.aqlcomposer.query.CompilerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Auto-configuration for the AQL compiler
 *
 * Registers the compiler, its literal serializer and compile metrics in any Spring Boot
 * application that has this library on the classpath. Compiler settings are read from
 * {@code aqlcomposer.compiler.*} properties:
 * - max-traversal-depth: largest traversal depth accepted (default 65535)
 * - log-queries: log every compiled statement at INFO instead of DEBUG (default false)
 *
 * A {@link SimpleMeterRegistry} is supplied when the application defines no registry
 * of its own, so metrics are always recorded somewhere.
 */
@AutoConfiguration
@Import({AqlLiteralSerializer.class, CompilerMetrics.class, AqlCompiler.class})
public class AqlComposerAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AqlComposerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry aqlComposerMeterRegistry() {
        logger.info("No MeterRegistry found, recording AQL compiler metrics in a SimpleMeterRegistry");
        return new SimpleMeterRegistry();
    }
}
