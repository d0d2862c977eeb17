package com.health.misinfo.config;

import com.health.misinfo.model.RiskLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger graphNodes;
    private final AtomicInteger graphEdges;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.graphNodes = registry.gauge("graph.nodes", new AtomicInteger(0));
        this.graphEdges = registry.gauge("graph.edges", new AtomicInteger(0));
    }

    public void recordGraphRebuild(int nodeCount, int edgeCount, Duration duration) {
        Counter.builder("graph.rebuild.count")
                .register(registry)
                .increment();

        Timer.builder("graph.rebuild.duration")
                .register(registry)
                .record(duration);

        graphNodes.set(nodeCount);
        graphEdges.set(edgeCount);
    }

    public void recordEdgesRejected(int count) {
        Counter.builder("graph.edges.rejected")
                .register(registry)
                .increment(count);
    }

    public void recordPostScored(RiskLevel level, double score) {
        Counter.builder("posts.scored")
                .tag("risk_level", level.name())
                .register(registry)
                .increment();

        DistributionSummary.builder("posts.score")
                .tag("risk_level", level.name())
                .register(registry)
                .record(score);
    }

    public void recordPostsRejected(int count) {
        Counter.builder("posts.rejected")
                .register(registry)
                .increment(count);
    }
}
