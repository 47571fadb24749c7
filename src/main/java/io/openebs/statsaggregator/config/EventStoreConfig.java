package io.openebs.statsaggregator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.openebs.statsaggregator.state.EventsCache;
import io.openebs.statsaggregator.store.ConfigMapEventStore;
import io.openebs.statsaggregator.store.CustomResourceEventStore;
import io.openebs.statsaggregator.store.EventBootstrapLoader;
import io.openebs.statsaggregator.store.EventSetCodec;
import io.openebs.statsaggregator.store.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.util.StringUtils;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Wiring for the persisted counters: Kubernetes client, store, bootstrap and the cache.
 *
 * The cache bean is only published once bootstrap has seeded it, so the Kafka listener,
 * the reconciler and the scrape endpoint, which all depend on it, start after bootstrap.
 * A bootstrap failure aborts context start-up.
 */
@Slf4j
@Configuration
@EnableScheduling
public class EventStoreConfig {

    static final String KIND_CUSTOM_RESOURCE = "custom-resource";
    static final String KIND_CONFIGMAP = "configmap";

    @Value("${events.store.kind:" + KIND_CUSTOM_RESOURCE + "}")
    private String kind;

    @Value("${events.store.name:}")
    private String name;

    @Value("${events.store.namespace:mayastor}")
    private String namespace;

    @Value("${events.store.field-manager:events_store}")
    private String fieldManager;

    @Value("${events.bootstrap.initial-backoff-ms:500}")
    private long initialBackoffMs;

    @Value("${events.bootstrap.max-backoff-ms:10000}")
    private long maxBackoffMs;

    @Value("${events.bootstrap.max-elapsed-ms:60000}")
    private long maxElapsedMs;

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        return new KubernetesClientBuilder().build();
    }

    @Bean
    public EventSetCodec eventSetCodec(ObjectMapper objectMapper) {
        return new EventSetCodec(objectMapper);
    }

    @Bean
    public EventStore eventStore(KubernetesClient kubernetesClient, EventSetCodec eventSetCodec) {
        EventStore store = switch (kind) {
            case KIND_CUSTOM_RESOURCE -> new CustomResourceEventStore(kubernetesClient, eventSetCodec,
                    namespace, nameOr(CustomResourceEventStore.DEFAULT_NAME), fieldManager);
            case KIND_CONFIGMAP -> new ConfigMapEventStore(kubernetesClient, eventSetCodec,
                    namespace, nameOr(ConfigMapEventStore.DEFAULT_NAME), fieldManager);
            default -> throw new IllegalArgumentException(
                    "Unknown events.store.kind '" + kind + "', expected "
                            + KIND_CUSTOM_RESOURCE + " or " + KIND_CONFIGMAP);
        };
        log.info("Event stats persisted in {}", store.describe());
        return store;
    }

    @Bean
    public BackOff bootstrapBackOff() {
        ExponentialBackOff backOff = new ExponentialBackOff(initialBackoffMs, 2.0);
        backOff.setMaxInterval(maxBackoffMs);
        backOff.setMaxElapsedTime(maxElapsedMs);
        return backOff;
    }

    @Bean
    public EventBootstrapLoader eventBootstrapLoader(EventStore eventStore, BackOff bootstrapBackOff) {
        return new EventBootstrapLoader(eventStore, bootstrapBackOff);
    }

    @Bean
    public EventsCache eventsCache(EventBootstrapLoader eventBootstrapLoader) {
        EventsCache cache = new EventsCache();
        cache.initialize(eventBootstrapLoader.load());
        return cache;
    }

    private String nameOr(String defaultName) {
        return StringUtils.hasText(name) ? name : defaultName;
    }
}
