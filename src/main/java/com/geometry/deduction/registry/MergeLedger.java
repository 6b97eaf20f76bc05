package com.geometry.deduction.registry;

import com.geometry.deduction.core.model.ObjectKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only ledger of every merge performed by an {@link EntityRegistry}.
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final List<MergeRecord> records = new ArrayList<>();

    /**
     * Appends a merge and returns the stored record.
     */
    public MergeRecord record(ObjectKind kind, String oldKey, String survivorKey, MergeReason reason) {
        MergeRecord record = new MergeRecord(records.size() + 1L, kind, oldKey, survivorKey, reason);
        records.add(record);
        log.debug("merge.recorded kind={} old={} survivor={} reason={}",
                kind, oldKey, survivorKey, reason);
        return record;
    }

    public List<MergeRecord> getAllRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<MergeRecord> getRecordsByKind(ObjectKind kind) {
        return records.stream()
                .filter(r -> r.kind() == kind)
                .collect(Collectors.toList());
    }

    public List<MergeRecord> getRecordsForSurvivor(ObjectKind kind, String survivorKey) {
        return records.stream()
                .filter(r -> r.kind() == kind && r.survivorKey().equals(survivorKey))
                .collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }

    /**
     * Gets every key that was merged, directly or transitively, into the given key.
     */
    public List<String> getMergeChain(ObjectKind kind, String key) {
        List<String> chain = new ArrayList<>();
        collectMergeChain(kind, key, key, chain);
        return chain;
    }

    private void collectMergeChain(ObjectKind kind, String root, String key, List<String> chain) {
        for (MergeRecord record : getRecordsForSurvivor(kind, key)) {
            // a rename can leave a record pointing back at an earlier key
            String old = record.oldKey();
            if (old.equals(root) || old.equals(key) || chain.contains(old)) {
                continue;
            }
            chain.add(old);
            collectMergeChain(kind, root, old, chain);
        }
    }
}
