package fr.lapetina.orchestrator.selection;

import fr.lapetina.orchestrator.domain.model.PerformanceSample;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-instance history of call outcomes. The oldest sample is dropped past capacity.
 */
final class PerformanceHistory {

    private final Map<String, Deque<PerformanceSample>> samples = new ConcurrentHashMap<>();
    private final int capacity;

    PerformanceHistory(int capacity) {
        this.capacity = capacity;
    }

    void append(String instanceId, PerformanceSample sample) {
        Deque<PerformanceSample> deque = samples.computeIfAbsent(instanceId, id -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(sample);
            while (deque.size() > capacity) {
                deque.removeFirst();
            }
        }
    }

    /**
     * The most recent {@code count} samples, oldest first.
     */
    List<PerformanceSample> recent(String instanceId, int count) {
        Deque<PerformanceSample> deque = samples.get(instanceId);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            List<PerformanceSample> all = new ArrayList<>(deque);
            return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
        }
    }

    int size(String instanceId) {
        Deque<PerformanceSample> deque = samples.get(instanceId);
        if (deque == null) {
            return 0;
        }
        synchronized (deque) {
            return deque.size();
        }
    }

    void remove(String instanceId) {
        samples.remove(instanceId);
    }
}
