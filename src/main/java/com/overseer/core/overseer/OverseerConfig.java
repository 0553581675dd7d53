package com.overseer.core.overseer;

import com.overseer.core.classify.IntentClassifier;
import com.overseer.core.dispatch.DirectiveManager;
import com.overseer.core.events.EventBus;
import com.overseer.core.events.EventSink;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.registry.TargetDirectory;
import com.overseer.core.registry.TargetRegistry;
import com.overseer.core.snapshot.SnapshotStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(OverseerProperties.class)
public class OverseerConfig {

    @Bean
    @ConditionalOnMissingBean(EventSink.class)
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public OverseerMetrics overseerMetrics(MeterRegistry meterRegistry) {
        return new OverseerMetrics(meterRegistry);
    }

    @Bean
    public TargetRegistry targetRegistry() {
        return new TargetRegistry();
    }

    @Bean
    public IntentClassifier intentClassifier() {
        return new IntentClassifier();
    }

    @Bean
    public SnapshotStore snapshotStore() {
        return new SnapshotStore();
    }

    /**
     * Runs directive manager and crew calls so they can be bounded by the dispatch timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService overseerDispatchExecutor(OverseerProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getDispatch().getThreads()), r -> {
            Thread t = new Thread(r, "overseer-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Overseer overseer(OverseerProperties properties,
                             TargetRegistry targetRegistry,
                             IntentClassifier intentClassifier,
                             EventSink eventSink,
                             OverseerMetrics overseerMetrics,
                             ExecutorService overseerDispatchExecutor,
                             @Autowired(required = false) DirectiveManager directiveManager,
                             @Autowired(required = false) TargetDirectory targetDirectory,
                             @Autowired(required = false) OverseerCallbacks callbacks) {
        return Overseer.builder()
                .properties(properties)
                .registry(targetRegistry)
                .classifier(intentClassifier)
                .eventSink(eventSink)
                .metrics(overseerMetrics)
                .dispatchExecutor(overseerDispatchExecutor)
                .directiveManager(directiveManager)
                .targetDirectory(targetDirectory)
                .callbacks(callbacks)
                .build();
    }
}
