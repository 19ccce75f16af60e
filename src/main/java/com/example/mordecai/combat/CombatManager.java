package com.example.mordecai.combat;

import com.example.mordecai.config.CombatConfig;
import com.example.mordecai.event.CombatEnded;
import com.example.mordecai.event.CombatStarted;
import com.example.mordecai.event.GameEventPublisher;
import com.example.mordecai.model.Combatant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages all active combat sessions.
 * Handles session creation and joining, flight, defense mode and the timed
 * attack penalties participants accumulate.
 */
public class CombatManager {

    private static final Logger logger = LoggerFactory.getLogger(CombatManager.class);

    public static final String REASON_FLED = "Fled";
    public static final String REASON_ONE_FLED = "One participant fled";

    /** All active sessions, keyed by session ID */
    private final Map<UUID, CombatSession> activeSessions = new ConcurrentHashMap<>();

    /** Map from combatant ID to the session it is actively fighting in */
    private final Map<UUID, CombatSession> sessionsByCombatant = new ConcurrentHashMap<>();

    private final GameEventPublisher publisher;
    private final Clock clock;
    private final long roundMillis;

    public CombatManager(GameEventPublisher publisher, Clock clock, CombatConfig config) {
        this.publisher = publisher;
        this.clock = clock;
        this.roundMillis = config.getRoundMillis();
    }

    // === Combat Initiation ===

    /**
     * Put attacker and defender into a common session. The attacker's own
     * session is reused first, then the defender's; otherwise a new session
     * is opened in the room.
     *
     * @return the session, or null if the two are not in the same room
     */
    public synchronized CombatSession initiateCombat(Combatant attacker, Combatant defender) {
        if (attacker.getRoomId() != defender.getRoomId()) {
            logger.debug("[CombatManager] {} cannot reach {}: different rooms", attacker.getName(), defender.getName());
            return null;
        }
        long now = clock.millis();

        CombatSession session = getActiveSession(attacker.getId());
        if (session != null) {
            if (session.getRoomId() != defender.getRoomId()) return null;
            if (getActiveSession(defender.getId()) == null) {
                join(session, defender, now);
            }
            return session;
        }

        session = getActiveSession(defender.getId());
        if (session != null) {
            if (session.getRoomId() != attacker.getRoomId()) return null;
            join(session, attacker, now);
            logger.debug("[CombatManager] {} joins combat {} in room {}", attacker.getName(), session.getId(), session.getRoomId());
            return session;
        }

        session = new CombatSession(UUID.randomUUID(), attacker.getRoomId(), now);
        activeSessions.put(session.getId(), session);
        join(session, attacker, now);
        join(session, defender, now);
        logger.info("[CombatManager] combat {} started in room {}: {} vs {}",
            session.getId(), session.getRoomId(), attacker.getName(), defender.getName());
        publisher.publish(new CombatStarted(attacker.getId(), attacker.getName(),
            defender.getId(), defender.getName(), session.getRoomId()));
        return session;
    }

    private void join(CombatSession session, Combatant combatant, long now) {
        session.addParticipant(combatant, now);
        sessionsByCombatant.put(combatant.getId(), session);
    }

    // === Leaving and ending ===

    /**
     * Take a combatant out of its session. If one or no fighters remain, the
     * session ends.
     *
     * @return false if the combatant was not fighting
     */
    public synchronized boolean fleeFromCombat(Combatant combatant) {
        CombatSession session = getActiveSession(combatant.getId());
        if (session == null) return false;
        CombatParticipant participant = session.findActiveParticipant(combatant.getId());
        if (participant == null) return false;

        long now = clock.millis();
        participant.leave(REASON_FLED, now);
        sessionsByCombatant.remove(combatant.getId(), session);
        session.appendLog(CombatActionLog.simple(now, combatant.getId(), combatant.getName(),
            CombatActionLog.ActionType.FLEE, combatant.getName() + " flees from combat!"));
        logger.info("[CombatManager] {} fled combat {}", combatant.getName(), session.getId());

        List<CombatParticipant> remaining = session.getActiveParticipants();
        if (remaining.size() <= 1) {
            Combatant winner = remaining.isEmpty() ? null : remaining.get(0).getCombatant();
            endCombat(session, REASON_ONE_FLED, winner);
        }
        return true;
    }

    /**
     * Take a combatant that died outside an attack out of its session. When
     * one or no fighters would remain, the whole session ends with the reason
     * and the survivor, if any, wins.
     *
     * @return false if the combatant was not fighting
     */
    public synchronized boolean removeDeadCombatant(Combatant combatant, String reason) {
        CombatSession session = getActiveSession(combatant.getId());
        if (session == null) return false;
        CombatParticipant participant = session.findActiveParticipant(combatant.getId());
        if (participant == null) return false;

        long now = clock.millis();
        session.appendLog(CombatActionLog.simple(now, combatant.getId(), combatant.getName(),
            CombatActionLog.ActionType.DEATH, reason));

        List<CombatParticipant> survivors = new ArrayList<>();
        for (CombatParticipant p : session.getActiveParticipants()) {
            if (p != participant) survivors.add(p);
        }
        if (survivors.size() <= 1) {
            endCombat(session, reason, survivors.isEmpty() ? null : survivors.get(0).getCombatant());
            return true;
        }
        participant.leave(reason, now);
        sessionsByCombatant.remove(combatant.getId(), session);
        logger.info("[CombatManager] {} removed from combat {}: {}", combatant.getName(), session.getId(), reason);
        return true;
    }

    /**
     * End a session. Every participant still fighting leaves with the same reason.
     *
     * @param winner may be null
     */
    public synchronized void endCombat(CombatSession session, String reason, Combatant winner) {
        if (!session.end(reason, clock.millis())) return;
        activeSessions.remove(session.getId());
        for (CombatParticipant p : session.getParticipants()) {
            sessionsByCombatant.remove(p.getCombatant().getId(), session);
        }
        logger.info("[CombatManager] combat {} ended: {}", session.getId(), reason);
        publisher.publish(new CombatEnded(session.getRoomId(), reason,
            winner == null ? null : winner.getId(), winner == null ? null : winner.getName()));
    }

    // === Defense mode ===

    /**
     * Switch between parry (weapon skill, no fatigue cost) and dodge.
     *
     * @return false if the combatant is not fighting
     */
    public boolean setParryMode(Combatant combatant, boolean parry) {
        CombatSession session = getActiveSession(combatant.getId());
        if (session == null) return false;
        CombatParticipant participant = session.findActiveParticipant(combatant.getId());
        if (participant == null) return false;
        if (participant.isParryMode() != parry) {
            participant.setParryMode(parry);
            session.appendLog(CombatActionLog.simple(clock.millis(), combatant.getId(), combatant.getName(),
                CombatActionLog.ActionType.DEFENSE_MODE,
                combatant.getName() + (parry ? " shifts into a parrying stance." : " prepares to dodge.")));
        }
        return true;
    }

    // === Timed penalties ===

    /**
     * Record an over-extension penalty for a bad SV or RV.
     *
     * @return the penalty applied, or null if the value is not bad enough
     */
    public TimedPenalty applyTimedPenalty(CombatParticipant participant, int value) {
        CombatCalculator.PenaltySeverity severity = CombatCalculator.penaltySeverity(value);
        if (severity == null) return null;
        TimedPenalty penalty = new TimedPenalty(severity.amount(), clock.millis() + severity.rounds() * roundMillis);
        participant.addPenalty(penalty);
        logger.debug("[CombatManager] {} over-extends: {} for {} round(s)",
            participant.getCombatant().getName(), severity.amount(), severity.rounds());
        return penalty;
    }

    /** Sum of the combatant's unexpired penalties; 0 when not fighting. */
    public int getTotalTimedPenalties(Combatant combatant) {
        CombatSession session = getActiveSession(combatant.getId());
        if (session == null) return 0;
        CombatParticipant participant = session.findParticipant(combatant.getId());
        return participant == null ? 0 : participant.getTotalPenalty(clock.millis());
    }

    /**
     * Drop expired penalties in every active session.
     *
     * @return penalties removed
     */
    public int pruneExpiredPenalties() {
        long now = clock.millis();
        int removed = 0;
        for (CombatSession session : activeSessions.values()) {
            for (CombatParticipant p : session.getParticipants()) {
                removed += p.pruneExpiredPenalties(now);
            }
        }
        return removed;
    }

    void recordAction(CombatSession session, CombatActionLog entry) {
        session.appendLog(entry);
    }

    // === Query Methods ===

    /** The session this combatant is actively fighting in, or null. */
    public CombatSession getActiveSession(UUID combatantId) {
        if (combatantId == null) return null;
        CombatSession session = sessionsByCombatant.get(combatantId);
        if (session == null || !session.isActive()) return null;
        return session.findActiveParticipant(combatantId) != null ? session : null;
    }

    public boolean isInCombat(UUID combatantId) {
        return getActiveSession(combatantId) != null;
    }

    public List<CombatParticipant> getActiveParticipants(CombatSession session) {
        return session.getActiveParticipants();
    }

    public Collection<CombatSession> getActiveSessions() {
        return new ArrayList<>(activeSessions.values());
    }

    public int getActiveSessionCount() {
        return activeSessions.size();
    }
}
