/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import io.routegraph.kubernetes.api.gateway.GRPCRoute;
import io.routegraph.kubernetes.api.gateway.Gateway;
import io.routegraph.kubernetes.api.gateway.HTTPRoute;
import io.routegraph.kubernetes.api.gateway.ReferenceGrant;
import io.routegraph.kubernetes.api.gateway.TCPRoute;
import io.routegraph.kubernetes.api.gateway.TLSRoute;
import io.routegraph.kubernetes.api.v1.HTTPProxy;
import io.routegraph.kubernetes.api.v1.TLSCertificateDelegation;
import io.routegraph.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Feeds a {@link KubernetesCache} from fabric8 informers.
 * <p>Every add, update and delete that may alter the graph invokes the change listener. The sync listener is invoked
 * once, after every informer has synced and every object of the initial listing has been delivered into the cache,
 * not merely fetched by the informer.</p>
 */
public class InformerCacheBridge implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(InformerCacheBridge.class);

    @VisibleForTesting
    static final List<Class<? extends HasMetadata>> NAMESPACED_TYPES = List.of(
            HTTPProxy.class,
            TLSCertificateDelegation.class,
            Ingress.class,
            Secret.class,
            Service.class,
            Gateway.class,
            HTTPRoute.class,
            GRPCRoute.class,
            TLSRoute.class,
            TCPRoute.class,
            ReferenceGrant.class);

    private final KubernetesClient client;
    private final KubernetesCache cache;
    private final Set<String> watchedNamespaces;
    private final Runnable onChange;
    private final Runnable onInitialSync;
    private final List<SharedIndexInformer<? extends HasMetadata>> informers = new ArrayList<>();
    private final ScheduledExecutorService syncChecker = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "informer-sync-check");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicBoolean synced = new AtomicBoolean();

    /**
     * @param client the client
     * @param cache the cache to populate
     * @param watchedNamespaces the namespaces to watch, empty for all
     * @param onChange invoked after a change that may alter the graph
     * @param onInitialSync invoked once the initial listing has been delivered
     */
    public InformerCacheBridge(KubernetesClient client, KubernetesCache cache, Set<String> watchedNamespaces, Runnable onChange, Runnable onInitialSync) {
        this.client = client;
        this.cache = cache;
        this.watchedNamespaces = Set.copyOf(watchedNamespaces);
        this.onChange = onChange;
        this.onInitialSync = onInitialSync;
    }

    public void start() {
        for (Class<? extends HasMetadata> type : NAMESPACED_TYPES) {
            if (watchedNamespaces.isEmpty()) {
                informers.add(inform(type, null));
            }
            else {
                for (String namespace : watchedNamespaces.stream().sorted().toList()) {
                    informers.add(inform(type, namespace));
                }
            }
        }
        informers.add(client.namespaces().inform(new Handler<Namespace>(), 0));
        syncChecker.scheduleWithFixedDelay(this::checkInitialSync, 100, 100, TimeUnit.MILLISECONDS);
    }

    private <T extends HasMetadata> SharedIndexInformer<T> inform(Class<T> type, @Nullable String namespace) {
        var resources = client.resources(type);
        Handler<T> handler = new Handler<>();
        return namespace == null ? resources.inAnyNamespace().inform(handler, 0) : resources.inNamespace(namespace).inform(handler, 0);
    }

    @VisibleForTesting
    boolean checkInitialSync() {
        if (synced.get()) {
            return true;
        }
        boolean delivered = informers.stream().allMatch(informer -> informer.hasSynced()
                && informer.getStore().list().stream().allMatch(cache::contains));
        if (delivered && synced.compareAndSet(false, true)) {
            LOGGER.atInfo()
                    .setMessage("initial listing of {} informers delivered")
                    .addArgument(informers.size())
                    .log();
            onInitialSync.run();
            syncChecker.shutdown();
        }
        return delivered;
    }

    @Override
    public void close() {
        syncChecker.shutdownNow();
        informers.forEach(SharedIndexInformer::close);
    }

    private class Handler<T extends HasMetadata> implements ResourceEventHandler<T> {

        @Override
        public void onAdd(T resource) {
            if (cache.insert(resource)) {
                onChange.run();
            }
        }

        @Override
        public void onUpdate(T oldResource, T newResource) {
            if (cache.insert(newResource)) {
                onChange.run();
            }
        }

        @Override
        public void onDelete(T resource, boolean deletedFinalStateUnknown) {
            if (cache.remove(resource)) {
                onChange.run();
            }
        }
    }
}
