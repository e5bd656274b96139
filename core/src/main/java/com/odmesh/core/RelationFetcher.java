package com.odmesh.core;

import com.odmesh.core.property.NavigationProperty;
import com.tailoredshapes.stash.Stash;

import java.util.List;

/**
 * Loads a relation that was not embedded in the parent's payload. Implementations own
 * the transport; the returned records are hydrated into entities of the target type.
 */
public interface RelationFetcher {
    /**
     * @return the related record, or null when the parent has none
     */
    Stash fetchSingle(Entity parent, NavigationProperty<?> property);

    List<Stash> fetchCollection(Entity parent, NavigationProperty<?> property);
}
