package com.example.mordecai.persistence;

import com.example.mordecai.model.Combatant;

import java.util.Collection;
import java.util.UUID;

/**
 * Source of live combatant records. The durable store behind it belongs to
 * the host server.
 */
public interface CombatantRepository {

    /** @return the combatant, or null if unknown */
    Combatant findById(UUID id);

    /** Snapshot of every loaded combatant. */
    Collection<Combatant> findAll();

    void save(Combatant combatant);

    boolean remove(UUID id);
}
