package com.example.mordecai.combat;

import com.example.mordecai.model.Combatant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One combatant's membership in a {@link CombatSession}. Guarded by the
 * owning session's monitor.
 */
public class CombatParticipant {

    private final Combatant combatant;
    private final long joinedAt;

    /** Whether this participant is still fighting */
    private boolean active = true;

    /** Parry uses weapon skill and costs no fatigue; dodge uses DODGE and costs 1 */
    private boolean parryMode = false;

    private final List<TimedPenalty> penalties = new ArrayList<>();

    private Long leftAt;
    private String leaveReason;

    CombatParticipant(Combatant combatant, long joinedAt) {
        this.combatant = combatant;
        this.joinedAt = joinedAt;
    }

    public Combatant getCombatant() { return combatant; }
    public long getJoinedAt() { return joinedAt; }

    public synchronized boolean isActive() { return active; }
    public synchronized boolean isParryMode() { return parryMode; }
    public synchronized void setParryMode(boolean parryMode) { this.parryMode = parryMode; }

    public synchronized Long getLeftAt() { return leftAt; }
    public synchronized String getLeaveReason() { return leaveReason; }

    synchronized void leave(String reason, long now) {
        if (!active) return;
        this.active = false;
        this.leftAt = now;
        this.leaveReason = reason;
    }

    synchronized void rejoin() {
        this.active = true;
        this.leftAt = null;
        this.leaveReason = null;
    }

    synchronized void addPenalty(TimedPenalty penalty) {
        penalties.add(penalty);
    }

    /**
     * @return number of penalties dropped
     */
    synchronized int pruneExpiredPenalties(long now) {
        int before = penalties.size();
        penalties.removeIf(p -> p.isExpired(now));
        return before - penalties.size();
    }

    /** Sum of penalties still in force; expired ones are pruned first. */
    synchronized int getTotalPenalty(long now) {
        pruneExpiredPenalties(now);
        int total = 0;
        for (TimedPenalty p : penalties) total += p.amount();
        return total;
    }

    public synchronized List<TimedPenalty> getPenalties() {
        return Collections.unmodifiableList(new ArrayList<>(penalties));
    }

    @Override
    public String toString() {
        return "CombatParticipant{" + combatant.getName() + (isActive() ? "" : ", left: " + getLeaveReason()) + "}";
    }
}
