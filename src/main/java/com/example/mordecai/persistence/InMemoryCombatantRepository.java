package com.example.mordecai.persistence;

import com.example.mordecai.model.Combatant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCombatantRepository implements CombatantRepository {

    private final Map<UUID, Combatant> combatants = new ConcurrentHashMap<>();

    @Override
    public Combatant findById(UUID id) {
        if (id == null) return null;
        return combatants.get(id);
    }

    @Override
    public Collection<Combatant> findAll() {
        return new ArrayList<>(combatants.values());
    }

    @Override
    public void save(Combatant combatant) {
        if (combatant != null) combatants.put(combatant.getId(), combatant);
    }

    @Override
    public boolean remove(UUID id) {
        return id != null && combatants.remove(id) != null;
    }
}
