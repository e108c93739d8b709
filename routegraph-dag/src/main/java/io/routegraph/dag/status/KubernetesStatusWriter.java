/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * Writes status through the Kubernetes API.
 * <p>The live object is re-read before each write so that the update is applied to its current resource version;
 * a concurrent modification therefore fails the write rather than overwriting it.</p>
 */
public class KubernetesStatusWriter implements StatusWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesStatusWriter.class);

    private final KubernetesClient client;

    public KubernetesStatusWriter(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public void write(StatusUpdate update) {
        HasMetadata live = client.resources(update.resourceType())
                .inNamespace(update.key().name().namespace())
                .withName(update.key().name().name())
                .get();
        if (live == null) {
            LOGGER.atDebug()
                    .setMessage("Skipping status of {} which no longer exists")
                    .addArgument(update.key())
                    .log();
            return;
        }
        if (!update.applyTo(live)) {
            LOGGER.atDebug()
                    .setMessage("{} has no status to write")
                    .addArgument(update.key())
                    .log();
            return;
        }
        client.resource(live).updateStatus();
    }
}
