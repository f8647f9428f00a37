package com.e2eq.streamquery.engine;

import com.e2eq.streamquery.exceptions.CapacityExceededException;
import com.e2eq.streamquery.model.RunningQuerySnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executions currently running in this process, indexed by fingerprint. Not shared across
 * processes and not persisted.
 */
public class ExecutionRegistry {

    private final Map<Long, RunningQuery> running = new ConcurrentHashMap<>();

    /**
     * Registers {@code query} unless its fingerprint is already running here.
     *
     * @param maxParallelProcesses admission limit, zero or less for none
     * @return false when the fingerprint is already registered
     * @throws CapacityExceededException when the limit has been reached
     */
    public synchronized boolean admit(RunningQuery query, int maxParallelProcesses) {
        if (running.containsKey(query.getFingerprint())) {
            return false;
        }
        if (maxParallelProcesses > 0 && running.size() >= maxParallelProcesses) {
            throw new CapacityExceededException(query.getFingerprint(), maxParallelProcesses);
        }
        running.put(query.getFingerprint(), query);
        return true;
    }

    /**
     * Removes {@code query}, but only if it is still the registered instance for its fingerprint.
     */
    public void deregister(RunningQuery query) {
        running.remove(query.getFingerprint(), query);
    }

    public Optional<RunningQuery> find(long fingerprint) {
        return Optional.ofNullable(running.get(fingerprint));
    }

    public boolean requestAbort(long fingerprint) {
        RunningQuery query = running.get(fingerprint);
        if (query == null) {
            return false;
        }
        query.requestAbort();
        return true;
    }

    public int size() {
        return running.size();
    }

    /**
     * Copies of every running record, oldest first.
     */
    public List<RunningQuerySnapshot> snapshots() {
        List<RunningQuerySnapshot> out = new ArrayList<>(running.size());
        for (RunningQuery query : running.values()) {
            out.add(query.snapshot());
        }
        out.sort(Comparator.comparing(RunningQuerySnapshot::startedAt));
        return out;
    }
}
