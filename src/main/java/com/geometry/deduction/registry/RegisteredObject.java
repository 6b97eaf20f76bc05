package com.geometry.deduction.registry;

import com.geometry.deduction.core.model.ObjectKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Base class for everything tracked by the {@link EntityRegistry}.
 *
 * <p>An object carries a canonical key, unique within its {@link ObjectKind}. Once it
 * has been merged into a survivor it keeps a successor reference, and every public
 * accessor of a subclass reads through {@link #live()} so that a stale handle keeps
 * answering with the survivor's current state, across any number of merges.</p>
 */
public abstract class RegisteredObject {

    private String key;
    private RegisteredObject successor;
    private final Set<ChangeListener> listeners = new LinkedHashSet<>();

    protected RegisteredObject(String key) {
        this.key = key;
    }

    public abstract ObjectKind kind();

    /** Current canonical key of the surviving object. */
    public String getKey() {
        return live().key;
    }

    public boolean isSuperseded() {
        return successor != null;
    }

    /**
     * Follows the successor chain to the final survivor, compressing the path so that
     * later lookups take a single hop.
     */
    public RegisteredObject live() {
        RegisteredObject last = this;
        while (last.successor != null) {
            last = last.successor;
        }
        RegisteredObject node = this;
        while (node.successor != null && node.successor != last) {
            RegisteredObject next = node.successor;
            node.successor = last;
            node = next;
        }
        return last;
    }

    /**
     * Subscribes to renames and merges of the live object. Subscriptions follow the
     * object across merges.
     */
    public void addChangeListener(ChangeListener listener) {
        live().listeners.add(listener);
    }

    /**
     * Structural identity used by {@link EntityRegistry#removeDuplicates(Class)}.
     * Two live objects of the same kind with equal identities denote the same thing.
     */
    protected List<Object> identity() {
        return List.of(key);
    }

    /**
     * Hook invoked by {@link EntityRegistry#replace} before this object is retired;
     * subclasses move facts (measures, flags) onto the survivor.
     */
    protected void absorbInto(RegisteredObject survivor) {
    }

    /**
     * Guards internal mutating paths that must never run on a superseded object.
     *
     * @throws StaleReferenceException if this object has a successor
     */
    protected void requireLive(String operation) {
        if (successor != null) {
            throw new StaleReferenceException(key, "Cannot " + operation + " on superseded "
                    + kind().getLabel() + " '" + key + "' (merged into '" + live().key + "')");
        }
    }

    String rawKey() {
        return key;
    }

    void setKey(String key) {
        this.key = key;
    }

    void setSuccessor(RegisteredObject successor) {
        this.successor = successor;
    }

    Set<ChangeListener> listeners() {
        return listeners;
    }

    List<ChangeListener> listenersSnapshot() {
        return new ArrayList<>(listeners);
    }
}
