package com.aqlcomposer.config;

import com.aqlcomposer.query.AqlCompilationException;
import com.aqlcomposer.query.AqlCompiler;
import com.aqlcomposer.query.AqlLiteralSerializer;
import com.aqlcomposer.query.CompilerMetrics;
import com.aqlcomposer.query.Query;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AqlComposerAutoConfiguration Tests")
class AqlComposerAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AqlComposerAutoConfiguration.class));

    @Configuration
    static class HostMeterRegistryConfig {
        @Bean
        MeterRegistry hostRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Test
    @DisplayName("Should register compiler components with default settings")
    void shouldRegisterComponents() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AqlCompiler.class);
            assertThat(context).hasSingleBean(AqlLiteralSerializer.class);
            assertThat(context).hasSingleBean(CompilerMetrics.class);
            assertThat(context).hasSingleBean(MeterRegistry.class);

            AqlCompiler compiler = context.getBean(AqlCompiler.class);
            assertThat(compiler.getMaxTraversalDepth()).isEqualTo(65535);
            assertThat(compiler.isLogQueries()).isFalse();
        });
    }

    @Test
    @DisplayName("Should bind compiler properties")
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues("aqlcomposer.compiler.max-traversal-depth=3",
                        "aqlcomposer.compiler.log-queries=true")
                .run(context -> {
                    AqlCompiler compiler = context.getBean(AqlCompiler.class);
                    assertThat(compiler.getMaxTraversalDepth()).isEqualTo(3);
                    assertThat(compiler.isLogQueries()).isTrue();
                    assertThatThrownBy(() -> compiler.compile(Query.outbound(1, 4, "knows", "User/1")))
                            .isInstanceOf(AqlCompilationException.class);
                });
    }

    @Test
    @DisplayName("Should record metrics in the host registry")
    void shouldUseHostRegistry() {
        contextRunner
                .withUserConfiguration(HostMeterRegistryConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(MeterRegistry.class);
                    assertThat(context).hasBean("hostRegistry");

                    context.getBean(AqlCompiler.class).compile(Query.collection("User"));

                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertThat(registry.get("aqlcomposer.compile.succeeded").counter().count()).isEqualTo(1.0);
                });
    }
}
