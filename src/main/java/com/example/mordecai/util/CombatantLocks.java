package com.example.mordecai.util;

import com.example.mordecai.model.Combatant;

import java.util.function.Supplier;

/**
 * Runs work while holding combatant locks. Pairs of combatants are always
 * locked in id order so an attack and a concurrent tick cannot deadlock.
 */
public final class CombatantLocks {

    private CombatantLocks() {}

    public static <T> T withLock(Combatant combatant, Supplier<T> work) {
        combatant.getLock().lock();
        try {
            return work.get();
        } finally {
            combatant.getLock().unlock();
        }
    }

    public static <T> T withBoth(Combatant a, Combatant b, Supplier<T> work) {
        if (a == b || a.getId().equals(b.getId())) {
            return withLock(a, work);
        }
        Combatant first = a.getId().compareTo(b.getId()) < 0 ? a : b;
        Combatant second = first == a ? b : a;
        first.getLock().lock();
        try {
            second.getLock().lock();
            try {
                return work.get();
            } finally {
                second.getLock().unlock();
            }
        } finally {
            first.getLock().unlock();
        }
    }
}
