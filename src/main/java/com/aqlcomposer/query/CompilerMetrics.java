package com.aqlcomposer.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for AQL compilation
 * Tracks compiled and rejected descriptors, compile latency,
 * scope chain length and size of the generated statements
 */
@Component
public class CompilerMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter compilationsSucceeded;
    private Counter compilationsRejected;
    private Timer compileLatency;
    private DistributionSummary scopesPerQuery;
    private DistributionSummary queryLength;

    @PostConstruct
    public void init() {
        compilationsSucceeded = Counter.builder("aqlcomposer.compile.succeeded")
            .description("Total number of query descriptors compiled to AQL")
            .register(meterRegistry);

        compilationsRejected = Counter.builder("aqlcomposer.compile.rejected")
            .description("Total number of query descriptors rejected by the compiler")
            .register(meterRegistry);

        compileLatency = Timer.builder("aqlcomposer.compile.latency")
            .description("Latency of compiling a query descriptor")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofNanos(1000))
            .maximumExpectedValue(Duration.ofMillis(100))
            .register(meterRegistry);

        scopesPerQuery = DistributionSummary.builder("aqlcomposer.compile.scopes")
            .description("Number of FOR scopes per compiled query")
            .baseUnit("scopes")
            .register(meterRegistry);

        queryLength = DistributionSummary.builder("aqlcomposer.compile.length")
            .description("Length of compiled AQL statements")
            .baseUnit("characters")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public Timer.Sample startCompileTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordCompileLatency(Timer.Sample sample) {
        sample.stop(compileLatency);
    }

    public void recordCompiled(int scopes, int length) {
        compilationsSucceeded.increment();
        scopesPerQuery.record(scopes);
        queryLength.record(length);
    }

    public void recordRejected() {
        compilationsRejected.increment();
    }

    /**
     * Share of compilations that were rejected
     * @return rejection rate (0-100) or 0 if nothing was compiled yet
     */
    public double getRejectionRate() {
        double rejected = compilationsRejected.count();
        double total = rejected + compilationsSucceeded.count();

        if (total == 0) {
            return 0.0;
        }

        return (rejected / total) * 100.0;
    }

    // Getter methods for testing
    public Counter getCompilationsSucceeded() {
        return compilationsSucceeded;
    }

    public Counter getCompilationsRejected() {
        return compilationsRejected;
    }

    public Timer getCompileLatency() {
        return compileLatency;
    }

    public DistributionSummary getScopesPerQuery() {
        return scopesPerQuery;
    }

    public DistributionSummary getQueryLength() {
        return queryLength;
    }
}
