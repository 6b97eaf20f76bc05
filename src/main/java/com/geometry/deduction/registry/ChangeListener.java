package com.geometry.deduction.registry;

/**
 * Listener for changes of a registered object. Implementations react to a rename
 * (key change in place) or to the object being merged into a survivor.
 *
 * Notifications are delivered from the registry's worklist, never re-entrantly.
 */
public interface ChangeListener {

    /**
     * Called after {@code source} changed.
     *
     * @param source      the object that changed or was merged away
     * @param replacement the survivor if {@code source} was merged, otherwise {@code null}
     */
    void onChange(RegisteredObject source, RegisteredObject replacement);
}
