package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.InstanceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of provider instances.
 *
 * Thread-safe storage and access for the instance pool.
 * Supports dynamic updates and notifications.
 */
public final class InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    private static final Comparator<AiInstance> BY_ID = Comparator.comparing(AiInstance::getId);

    private final Map<String, AiInstance> instances = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new instance or replaces an existing one with the same id.
     */
    public void register(AiInstance instance) {
        AiInstance previous = instances.put(instance.getId(), instance);
        if (previous == null) {
            log.info("Instance registered: {}", instance);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.ADDED, instance));
        } else {
            log.info("Instance updated: {}", instance);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.UPDATED, instance));
        }
    }

    /**
     * Removes an instance by id.
     *
     * @return the removed instance, or null if unknown
     */
    public AiInstance deregister(String instanceId) {
        AiInstance removed = instances.remove(instanceId);
        if (removed != null) {
            log.info("Instance removed: {}", removed);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.REMOVED, removed));
        }
        return removed;
    }

    public Optional<AiInstance> get(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    /**
     * All instances, ordered by id.
     */
    public List<AiInstance> getAll() {
        List<AiInstance> all = new ArrayList<>(instances.values());
        all.sort(BY_ID);
        return all;
    }

    /**
     * Active instances, ordered by id.
     */
    public List<AiInstance> getActive() {
        return instances.values().stream()
                .filter(AiInstance::isActive)
                .sorted(BY_ID)
                .toList();
    }

    /**
     * Instances able to take a request for {@code model} right now, ordered by id.
     */
    public List<AiInstance> getSelectable(String model, int failoverThreshold) {
        return instances.values().stream()
                .filter(instance -> instance.isSelectable(model, failoverThreshold))
                .sorted(BY_ID)
                .toList();
    }

    /**
     * Changes the status of an instance, notifying listeners when it actually changes.
     */
    public void updateStatus(String instanceId, InstanceStatus status) {
        AiInstance instance = instances.get(instanceId);
        if (instance != null) {
            InstanceStatus previous = instance.setStatus(status);
            if (previous != status) {
                log.info("Instance status changed: instanceId={}, {} -> {}", instanceId, previous, status);
                notifyListeners(new RegistryEvent(RegistryEvent.Type.STATUS_CHANGED, instance));
            }
        }
    }

    /**
     * Replaces all instances with a new set.
     * Used for configuration reload.
     */
    public void replaceAll(Collection<AiInstance> newInstances) {
        Set<String> newIds = new HashSet<>();

        for (AiInstance instance : newInstances) {
            newIds.add(instance.getId());
            register(instance);
        }

        for (String existingId : new ArrayList<>(instances.keySet())) {
            if (!newIds.contains(existingId)) {
                deregister(existingId);
            }
        }

        log.info("Instance registry replaced: {} instances", instances.size());
    }

    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener", e);
            }
        }
    }

    public int size() {
        return instances.size();
    }

    /**
     * Event for registry changes.
     */
    public record RegistryEvent(Type type, AiInstance instance) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED,
            STATUS_CHANGED
        }
    }
}
