package com.example.mordecai.effect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory registry for effect definitions and the active effect instances
 * on each combatant. Built once at startup and handed to the services that
 * need it.
 */
public class EffectRegistry {

    private final Map<String, EffectDefinition> defs = new ConcurrentHashMap<>();
    private final Map<UUID, List<EffectInstance>> instancesByCombatant = new ConcurrentHashMap<>();
    private final Map<UUID, EffectInstance> instancesById = new ConcurrentHashMap<>();

    public void registerDefinition(EffectDefinition def) {
        if (def != null && def.getName() != null) defs.put(key(def.getName()), def);
    }

    /** Case-insensitive lookup by name; null if unknown. */
    public EffectDefinition getDefinition(String name) {
        if (name == null) return null;
        return defs.get(key(name));
    }

    public Collection<EffectDefinition> getAllDefinitions() {
        return Collections.unmodifiableCollection(defs.values());
    }

    public int getDefinitionCount() {
        return defs.size();
    }

    void addInstance(EffectInstance instance) {
        instancesByCombatant.computeIfAbsent(instance.getCombatantId(), k -> new CopyOnWriteArrayList<>()).add(instance);
        instancesById.put(instance.getId(), instance);
    }

    /** Drop a deactivated instance from the live indexes. */
    void removeInstance(EffectInstance instance) {
        instancesById.remove(instance.getId());
        List<EffectInstance> list = instancesByCombatant.get(instance.getCombatantId());
        if (list != null) {
            list.remove(instance);
            if (list.isEmpty()) instancesByCombatant.remove(instance.getCombatantId(), list);
        }
    }

    public EffectInstance getInstance(UUID effectId) {
        return effectId == null ? null : instancesById.get(effectId);
    }

    /** Live instances on a combatant in application order. */
    public List<EffectInstance> getInstances(UUID combatantId) {
        List<EffectInstance> list = instancesByCombatant.get(combatantId);
        if (list == null) return Collections.emptyList();
        return new ArrayList<>(list);
    }

    public Set<UUID> getCombatantsWithEffects() {
        return Collections.unmodifiableSet(instancesByCombatant.keySet());
    }

    public List<EffectInstance> getAllActiveInstances() {
        return new ArrayList<>(instancesById.values());
    }

    private static String key(String name) {
        return name.trim().toLowerCase();
    }
}
