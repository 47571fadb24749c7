package io.openebs.statsaggregator.store;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.openebs.statsaggregator.exception.EventStoreException;
import io.openebs.statsaggregator.model.EventSet;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.util.Optional;

/**
 * Stores the counters as JSON under {@value #DATA_KEY} in a ConfigMap.
 * Same schema as the custom resource spec, for clusters where the CRD is not installed.
 */
@Slf4j
public class ConfigMapEventStore implements EventStore {

    public static final String DEFAULT_NAME = "events-store-cm";
    public static final String DATA_KEY = "stats.json";

    private final KubernetesClient client;
    private final EventSetCodec codec;
    private final String namespace;
    private final String name;
    private final String fieldManager;

    public ConfigMapEventStore(KubernetesClient client, EventSetCodec codec,
                               String namespace, String name, String fieldManager) {
        this.client = client;
        this.codec = codec;
        this.namespace = namespace;
        this.name = name;
        this.fieldManager = fieldManager;
    }

    @Override
    public Optional<EventSet> fetch() {
        ConfigMap configMap;
        try {
            configMap = client.configMaps().inNamespace(namespace).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new EventStoreException("Could not read " + describe(), e);
        }
        if (configMap == null) {
            return Optional.empty();
        }
        if (configMap.getData() == null || !configMap.getData().containsKey(DATA_KEY)) {
            throw new EventStoreException(describe() + " has no '" + DATA_KEY + "' entry");
        }
        return Optional.of(codec.fromJson(configMap.getData().get(DATA_KEY)));
    }

    @Override
    public boolean createIfAbsent(EventSet initial) {
        try {
            client.configMaps().inNamespace(namespace).resource(toConfigMap(initial)).create();
            log.info("Created {}", describe());
            return true;
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                log.info("{} already exists", describe());
                return false;
            }
            throw new EventStoreException("Could not create " + describe(), e);
        }
    }

    @Override
    public void apply(EventSet events) {
        PatchContext apply = new PatchContext.Builder()
                .withPatchType(PatchType.SERVER_SIDE_APPLY)
                .withFieldManager(fieldManager)
                .withForce(true)
                .build();
        try {
            client.configMaps().inNamespace(namespace).withName(name).patch(apply, toConfigMap(events));
        } catch (KubernetesClientException e) {
            throw new EventStoreException("Could not apply " + describe(), e);
        }
    }

    @Override
    public String describe() {
        return "ConfigMap " + namespace + "/" + name;
    }

    private ConfigMap toConfigMap(EventSet events) {
        return new ConfigMapBuilder()
                .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
                .endMetadata()
                .addToData(DATA_KEY, codec.toJson(events))
                .build();
    }
}
