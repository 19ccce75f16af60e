package com.example.mordecai.persistence;

import com.example.mordecai.model.EquippedItem;

import java.util.List;
import java.util.UUID;

/**
 * Read access to what a combatant is wearing and wielding.
 */
public interface EquipmentRepository {

    /** Items currently equipped by the combatant; never null. */
    List<EquippedItem> getEquippedItems(UUID combatantId);
}
