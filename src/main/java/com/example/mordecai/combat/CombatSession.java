package com.example.mordecai.combat;

import com.example.mordecai.model.Combatant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A combat encounter in one room. Participants are kept in join order;
 * the action log is append-only.
 */
public class CombatSession {

    /** Unique identifier for this session */
    private final UUID id;

    /** Room where this combat is taking place */
    private final int roomId;

    private CombatState state = CombatState.ACTIVE;

    private final long startedAt;
    private Long endedAt;
    private String endReason;

    private final List<CombatParticipant> participants = new ArrayList<>();
    private final List<CombatActionLog> log = new ArrayList<>();

    public CombatSession(UUID id, int roomId, long startedAt) {
        this.id = id == null ? UUID.randomUUID() : id;
        this.roomId = roomId;
        this.startedAt = startedAt;
    }

    public UUID getId() { return id; }
    public int getRoomId() { return roomId; }
    public long getStartedAt() { return startedAt; }

    public synchronized CombatState getState() { return state; }
    public synchronized boolean isActive() { return state == CombatState.ACTIVE; }
    public synchronized Long getEndedAt() { return endedAt; }
    public synchronized String getEndReason() { return endReason; }

    /**
     * Add a combatant, or reactivate its existing participant entry.
     */
    synchronized CombatParticipant addParticipant(Combatant combatant, long now) {
        CombatParticipant existing = findParticipant(combatant.getId());
        if (existing != null) {
            existing.rejoin();
            return existing;
        }
        CombatParticipant p = new CombatParticipant(combatant, now);
        participants.add(p);
        return p;
    }

    /** @return the participant for this combatant, or null */
    public synchronized CombatParticipant findParticipant(UUID combatantId) {
        for (CombatParticipant p : participants) {
            if (p.getCombatant().getId().equals(combatantId)) return p;
        }
        return null;
    }

    /** Active participant for this combatant, or null. */
    public synchronized CombatParticipant findActiveParticipant(UUID combatantId) {
        CombatParticipant p = findParticipant(combatantId);
        return p != null && p.isActive() ? p : null;
    }

    public synchronized List<CombatParticipant> getParticipants() {
        return Collections.unmodifiableList(new ArrayList<>(participants));
    }

    public synchronized List<CombatParticipant> getActiveParticipants() {
        List<CombatParticipant> out = new ArrayList<>();
        for (CombatParticipant p : participants) {
            if (p.isActive()) out.add(p);
        }
        return out;
    }

    synchronized void appendLog(CombatActionLog entry) {
        log.add(entry);
    }

    public synchronized List<CombatActionLog> getLog() {
        return Collections.unmodifiableList(new ArrayList<>(log));
    }

    /**
     * Mark the session ended and every remaining participant as left.
     *
     * @return false if it had already ended
     */
    synchronized boolean end(String reason, long now) {
        if (state == CombatState.ENDED) return false;
        for (CombatParticipant p : participants) {
            p.leave(reason, now);
        }
        state = CombatState.ENDED;
        endedAt = now;
        endReason = reason;
        return true;
    }

    @Override
    public synchronized String toString() {
        return "CombatSession{" + id + ", room " + roomId + ", " + state.getDisplayName()
            + ", " + participants.size() + " participants}";
    }
}
