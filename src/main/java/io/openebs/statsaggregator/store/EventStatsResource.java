package io.openebs.statsaggregator.store;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Custom resource {@code eventstats.openebs.io/v1alpha1} holding the persisted counters.
 */
@Group(EventStatsResource.GROUP)
@Version(EventStatsResource.VERSION)
@Kind("EventStats")
@Plural("eventstats")
public class EventStatsResource extends CustomResource<EventStatsSpec, Void> implements Namespaced {

    public static final String GROUP = "openebs.io";
    public static final String VERSION = "v1alpha1";

    public static EventStatsResource of(String namespace, String name, EventStatsSpec spec) {
        EventStatsResource resource = new EventStatsResource();
        resource.setMetadata(new ObjectMetaBuilder()
                .withName(name)
                .withNamespace(namespace)
                .build());
        resource.setSpec(spec);
        return resource;
    }
}
