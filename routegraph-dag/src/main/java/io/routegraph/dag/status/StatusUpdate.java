/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * The conditions computed by one build for one source object.
 * <p>An update from a later build fully replaces one from an earlier build for the same {@link #key()}.</p>
 */
public interface StatusUpdate {

    /**
     * @return the object the conditions belong to
     */
    ObjectKey key();

    /**
     * @return the generation of the object the conditions were computed from
     */
    long generation();

    /**
     * @return the type used to read the live object back
     */
    Class<? extends HasMetadata> resourceType();

    /**
     * Replaces the status of the given live copy of the object with this update, merged with the conditions it
     * already carries.
     * @param live a freshly read copy of the object
     * @return false if there is nothing to persist for this kind of object
     */
    boolean applyTo(HasMetadata live);
}
