package io.openebs.statsaggregator.store;

import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.openebs.statsaggregator.exception.EventStoreException;
import io.openebs.statsaggregator.model.EventSet;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.util.Optional;

/**
 * Stores the counters in a namespaced {@link EventStatsResource}.
 * Updates are server-side applies under a fixed field manager, forcing conflicts.
 */
@Slf4j
public class CustomResourceEventStore implements EventStore {

    public static final String DEFAULT_NAME = "eventstats";

    private final KubernetesClient client;
    private final EventSetCodec codec;
    private final String namespace;
    private final String name;
    private final String fieldManager;

    public CustomResourceEventStore(KubernetesClient client, EventSetCodec codec,
                                    String namespace, String name, String fieldManager) {
        this.client = client;
        this.codec = codec;
        this.namespace = namespace;
        this.name = name;
        this.fieldManager = fieldManager;
    }

    @Override
    public Optional<EventSet> fetch() {
        EventStatsResource resource;
        try {
            resource = resources().withName(name).get();
        } catch (KubernetesClientException e) {
            throw new EventStoreException("Could not read " + describe(), e);
        }
        if (resource == null) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(resource.getSpec()));
    }

    @Override
    public boolean createIfAbsent(EventSet initial) {
        EventStatsResource resource = EventStatsResource.of(namespace, name, codec.encode(initial));
        try {
            resources().resource(resource).create();
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
        EventStatsResource resource = EventStatsResource.of(namespace, name, codec.encode(events));
        PatchContext apply = new PatchContext.Builder()
                .withPatchType(PatchType.SERVER_SIDE_APPLY)
                .withFieldManager(fieldManager)
                .withForce(true)
                .build();
        try {
            resources().withName(name).patch(apply, resource);
        } catch (KubernetesClientException e) {
            throw new EventStoreException("Could not apply " + describe(), e);
        }
    }

    @Override
    public String describe() {
        return "EventStats " + namespace + "/" + name;
    }

    private NonNamespaceOperation<EventStatsResource, KubernetesResourceList<EventStatsResource>, Resource<EventStatsResource>> resources() {
        return client.resources(EventStatsResource.class).inNamespace(namespace);
    }
}
