package com.geometry.deduction.registry;

import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.logging.LogContext;
import com.geometry.deduction.metrics.MetricsService;
import com.geometry.deduction.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical, typed, keyed storage for one session.
 *
 * <p>Each {@link ObjectKind} has its own key space. Renames that collide with an
 * existing key become merges, and every merge retires the old object behind a
 * successor reference so that existing handles keep working.</p>
 *
 * <p>Change notifications are not delivered recursively. {@link #broadcast} and
 * {@link #replace} enqueue them on a FIFO worklist which is drained by the outermost
 * call; notifications raised by listeners are appended to the same worklist. The number
 * of deliveries per drain is bounded so that a cascade that fails to converge is
 * reported instead of looping forever.</p>
 */
public class EntityRegistry {
    private static final Logger log = LoggerFactory.getLogger(EntityRegistry.class);

    public static final int DEFAULT_MAX_CASCADE_STEPS = 100_000;

    private record Notification(ChangeListener listener, RegisteredObject source,
                                RegisteredObject replacement) {
    }

    private final Map<ObjectKind, Map<String, RegisteredObject>> storage = new EnumMap<>(ObjectKind.class);
    private final Deque<Notification> pending = new ArrayDeque<>();
    private final MergeLedger ledger = new MergeLedger();
    private final MetricsService metricsService;
    private final int maxCascadeSteps;
    private boolean draining;

    public EntityRegistry() {
        this(DEFAULT_MAX_CASCADE_STEPS, new NoOpMetricsService());
    }

    public EntityRegistry(int maxCascadeSteps, MetricsService metricsService) {
        if (maxCascadeSteps <= 0) {
            throw new IllegalArgumentException("maxCascadeSteps must be positive");
        }
        this.maxCascadeSteps = maxCascadeSteps;
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        for (ObjectKind kind : ObjectKind.values()) {
            storage.put(kind, new LinkedHashMap<>());
        }
    }

    // ========== Lookup ==========

    public <T extends RegisteredObject> Optional<T> get(Class<T> type, String key) {
        RegisteredObject found = storage.get(ObjectKind.of(type)).get(key);
        return Optional.ofNullable(found).map(type::cast);
    }

    /**
     * Snapshot of the live objects of exactly this kind, in registration order.
     */
    public <T extends RegisteredObject> List<T> elements(Class<T> type) {
        List<T> result = new ArrayList<>();
        storage.get(ObjectKind.of(type)).values().forEach(o -> result.add(type.cast(o)));
        return result;
    }

    /**
     * Snapshot of the live objects of this kind and its subordinate kinds.
     */
    public <T extends RegisteredObject> List<T> elementsRecursive(Class<T> type) {
        ObjectKind root = ObjectKind.of(type);
        List<T> result = new ArrayList<>();
        for (ObjectKind kind : ObjectKind.values()) {
            if (kind.isA(root)) {
                storage.get(kind).values().forEach(o -> result.add(type.cast(o)));
            }
        }
        return result;
    }

    public int size(ObjectKind kind) {
        return storage.get(kind).size();
    }

    public MergeLedger getMergeLedger() {
        return ledger;
    }

    // ========== Mutation ==========

    /**
     * Adds a new object under its current key.
     *
     * @throws IllegalStateException if the key is already taken within the kind
     */
    public <T extends RegisteredObject> T register(T object) {
        object.requireLive("register");
        Map<String, RegisteredObject> byKey = storage.get(object.kind());
        RegisteredObject existing = byKey.get(object.rawKey());
        if (existing != null && existing != object) {
            throw new IllegalStateException(object.kind().getLabel() + " '" + object.rawKey()
                    + "' is already registered");
        }
        byKey.put(object.rawKey(), object);
        metricsService.incrementEntityCreated(object.kind());
        log.trace("registry.registered kind={} key={}", object.kind(), object.rawKey());
        return object;
    }

    /**
     * Renames an object. If another object of the same kind already holds
     * {@code newKey}, the object is merged into it instead.
     *
     * @return the live object now holding {@code newKey}
     */
    public RegisteredObject updateKey(RegisteredObject object, String newKey) {
        RegisteredObject live = object.live();
        if (live.rawKey().equals(newKey)) {
            return live;
        }
        Map<String, RegisteredObject> byKey = storage.get(live.kind());
        RegisteredObject existing = byKey.get(newKey);
        if (existing != null && existing != live) {
            replace(live, existing, MergeReason.KEY_COLLISION);
            return existing;
        }
        String oldKey = live.rawKey();
        if (byKey.get(oldKey) == live) {
            byKey.remove(oldKey);
            byKey.put(newKey, live);
        }
        live.setKey(newKey);
        log.debug("registry.renamed kind={} old={} new={}", live.kind(), oldKey, newKey);
        broadcast(live, null);
        return live;
    }

    public void replace(RegisteredObject old, RegisteredObject survivor) {
        replace(old, survivor, MergeReason.EXPLICIT);
    }

    /**
     * Retires {@code old} in favour of {@code survivor}: facts held by {@code old} are
     * absorbed, its listeners are notified and moved to the survivor, it leaves storage
     * and every later access through it forwards to the survivor.
     *
     * <p>The survivor does not have to be registered; a resolved expression, for
     * example, is a terminal successor that is never stored.</p>
     */
    public void replace(RegisteredObject old, RegisteredObject survivor, MergeReason reason) {
        Objects.requireNonNull(survivor, "survivor is required");
        RegisteredObject target = survivor.live();
        if (old.kind() != target.kind()) {
            throw new IllegalArgumentException("Cannot replace " + old.kind().getLabel()
                    + " with " + target.kind().getLabel());
        }
        old.requireLive("replace");
        if (old == target) {
            return;
        }
        try (LogContext ignored = LogContext.forMerge(old.kind().name(), old.rawKey(), target.rawKey())) {
            old.absorbInto(target);

            for (ChangeListener listener : old.listenersSnapshot()) {
                pending.add(new Notification(listener, old, target));
                if (listener != target) {
                    target.listeners().add(listener);
                }
            }
            old.listeners().clear();

            Map<String, RegisteredObject> byKey = storage.get(old.kind());
            if (byKey.get(old.rawKey()) == old) {
                byKey.remove(old.rawKey());
            }
            old.setSuccessor(target);

            ledger.record(old.kind(), old.rawKey(), target.rawKey(), reason);
            metricsService.incrementEntityMerged(old.kind());
            log.debug("registry.replaced kind={} old={} survivor={} reason={}",
                    old.kind(), old.rawKey(), target.rawKey(), reason);
        }
        drain();
    }

    /**
     * Collapses live objects of a kind that share a structural identity. The first
     * registered object of each group survives. Repeats until no group is left, since
     * one merge can make further objects identical.
     *
     * @return number of objects merged away
     */
    public int removeDuplicates(Class<? extends RegisteredObject> type) {
        int merged = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            Map<List<Object>, RegisteredObject> firstByIdentity = new LinkedHashMap<>();
            for (RegisteredObject object : elements(type)) {
                if (object.isSuperseded()) {
                    continue;
                }
                RegisteredObject first = firstByIdentity.putIfAbsent(object.identity(), object);
                if (first != null && !first.isSuperseded()) {
                    replace(object, first, MergeReason.DUPLICATE);
                    merged++;
                    changed = true;
                    // storage changed under the snapshot; start a fresh pass
                    break;
                }
            }
        }
        if (merged > 0) {
            log.debug("registry.duplicatesRemoved kind={} merged={}", ObjectKind.of(type), merged);
        }
        return merged;
    }

    // ========== Notifications ==========

    /**
     * Notifies the listeners of {@code source}. A null replacement means the source was
     * renamed in place.
     */
    public void broadcast(RegisteredObject source, RegisteredObject replacement) {
        for (ChangeListener listener : source.live().listenersSnapshot()) {
            pending.add(new Notification(listener, source, replacement));
        }
        drain();
    }

    private void drain() {
        if (draining) {
            return;
        }
        draining = true;
        int steps = 0;
        try {
            while (!pending.isEmpty()) {
                if (++steps > maxCascadeSteps) {
                    throw new IllegalStateException("Change cascade did not converge within "
                            + maxCascadeSteps + " steps");
                }
                Notification n = pending.poll();
                ChangeListener listener = n.listener();
                if (listener instanceof RegisteredObject registered) {
                    listener = (ChangeListener) registered.live();
                }
                listener.onChange(n.source(), n.replacement());
            }
        } finally {
            pending.clear();
            draining = false;
        }
        if (steps > 0) {
            log.trace("registry.cascadeDrained steps={}", steps);
        }
    }
}
