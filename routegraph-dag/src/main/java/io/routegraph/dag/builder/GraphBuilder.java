/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.micrometer.core.instrument.Timer;

import io.routegraph.dag.Metrics;
import io.routegraph.dag.ResourcesUtil;
import io.routegraph.dag.cache.ObjectCacheView;
import io.routegraph.dag.config.BuilderConfiguration;
import io.routegraph.dag.match.RegexValidator;
import io.routegraph.dag.model.Dag;
import io.routegraph.dag.processor.GatewayApiProcessor;
import io.routegraph.dag.processor.HTTPProxyProcessor;
import io.routegraph.dag.processor.IngressProcessor;
import io.routegraph.dag.processor.ListenerProcessor;
import io.routegraph.dag.processor.Processor;
import io.routegraph.dag.secret.SecretResolver;
import io.routegraph.dag.secret.SecretValidator;
import io.routegraph.dag.status.ConditionFactory;
import io.routegraph.dag.status.StatusCache;
import io.routegraph.tag.VisibleForTesting;

/**
 * Builds graph snapshots from a view of the cluster by running every processor in turn against a fresh context.
 * <p>Either a complete snapshot is produced or a {@link DagBuildException} is thrown; nothing is published
 * partially.</p>
 */
public class GraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraphBuilder.class);

    private final BuilderConfiguration configuration;
    private final Clock clock;
    private final List<Processor> processors;
    private final RegexValidator regexValidator;
    private final SecretValidator secretValidator = new SecretValidator();
    private final AtomicLong version = new AtomicLong();
    private final Timer rebuildTimer = Metrics.rebuildTimer();

    public GraphBuilder(BuilderConfiguration configuration, Clock clock) {
        this(configuration, clock, List.of(
                new ListenerProcessor(),
                new IngressProcessor(),
                new HTTPProxyProcessor(),
                new GatewayApiProcessor()));
    }

    @VisibleForTesting
    GraphBuilder(BuilderConfiguration configuration, Clock clock, List<Processor> processors) {
        this.configuration = configuration;
        this.clock = clock;
        this.processors = List.copyOf(processors);
        this.regexValidator = new RegexValidator(configuration.regex().maxProgramSize(), configuration.regex().warnProgramSize());
    }

    /**
     * @param cache a consistent view of the cluster
     * @return the snapshot and the conditions computed for it
     * @throws DagBuildException if a defect in the builder prevented completion
     */
    public BuildResult build(ObjectCacheView cache) {
        long next = version.incrementAndGet();
        LOGGER.atDebug()
                .setMessage("Building snapshot {}")
                .addArgument(next)
                .log();
        Timer.Sample sample = Timer.start();
        StatusCache statusCache = new StatusCache(new ConditionFactory(clock), configuration.controllerName());
        DagBuilder dagBuilder = new DagBuilder(configuration.routeConflictPolicy().winnerFirst(configuration.schemaPriority()), statusCache);
        BuildContext context = new BuildContext(cache, configuration, dagBuilder, statusCache, regexValidator, new SecretResolver(cache, secretValidator));
        try {
            for (Processor processor : processors) {
                processor.run(context);
                context.processing(null);
            }
            Dag dag = dagBuilder.freeze(next, configuration.disableRouteSorting());
            BuildResult result = new BuildResult(dag, statusCache.updates());
            LOGGER.atDebug()
                    .setMessage("Built snapshot {} with {} listeners and {} status updates")
                    .addArgument(next)
                    .addArgument(dag.listeners().size())
                    .addArgument(result.statusUpdates().size())
                    .log();
            return result;
        }
        catch (DagBuildException e) {
            Metrics.rebuildFailureCounter().increment();
            throw e;
        }
        catch (RuntimeException e) {
            Metrics.rebuildFailureCounter().increment();
            Object current = context.currentObject();
            throw new DagBuildException("building snapshot " + next + " failed" + (current == null ? "" : " while processing " + describe(current)), current, e);
        }
        finally {
            sample.stop(rebuildTimer);
        }
    }

    private static String describe(Object object) {
        if (object instanceof HasMetadata resource) {
            return ResourcesUtil.kind(resource) + " " + ResourcesUtil.namespacedName(resource);
        }
        return object.toString();
    }
}
