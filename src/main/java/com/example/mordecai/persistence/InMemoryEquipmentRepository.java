package com.example.mordecai.persistence;

import com.example.mordecai.model.EquipmentSlot;
import com.example.mordecai.model.EquippedItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryEquipmentRepository implements EquipmentRepository {

    private final Map<UUID, List<EquippedItem>> equipment = new ConcurrentHashMap<>();

    @Override
    public List<EquippedItem> getEquippedItems(UUID combatantId) {
        List<EquippedItem> items = equipment.get(combatantId);
        if (items == null) return Collections.emptyList();
        return new ArrayList<>(items);
    }

    /**
     * Equip an item, replacing whatever occupied the same slot.
     */
    public void equip(UUID combatantId, EquippedItem item) {
        List<EquippedItem> items = equipment.computeIfAbsent(combatantId, k -> new CopyOnWriteArrayList<>());
        EquipmentSlot slot = item.getSlot();
        if (slot != null) {
            items.removeIf(i -> i.getSlot() == slot);
        }
        items.add(item);
    }

    public boolean unequip(UUID combatantId, EquipmentSlot slot) {
        List<EquippedItem> items = equipment.get(combatantId);
        return items != null && items.removeIf(i -> i.getSlot() == slot);
    }

    public void clear(UUID combatantId) {
        equipment.remove(combatantId);
    }
}
