package com.example.mordecai.ai;

import com.example.mordecai.combat.CombatManager;
import com.example.mordecai.combat.CombatParticipant;
import com.example.mordecai.combat.CombatResult;
import com.example.mordecai.combat.CombatService;
import com.example.mordecai.combat.CombatSession;
import com.example.mordecai.config.CombatConfig;
import com.example.mordecai.event.CombatActionEvent;
import com.example.mordecai.event.GameEventPublisher;
import com.example.mordecai.model.Combatant;
import com.example.mordecai.model.NpcBehavior;
import com.example.mordecai.model.NpcSpawn;
import com.example.mordecai.util.CombatantLocks;
import com.example.mordecai.vitality.ActionRestriction;
import com.example.mordecai.vitality.VitalityRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combat decisions for NPCs, evaluated once per health tick: flee when
 * badly hurt, parry when low on fatigue, otherwise attack the first player
 * still fighting. An NPC with 1 available vitality or less does nothing.
 */
public class NpcAiService {

    private static final Logger logger = LoggerFactory.getLogger(NpcAiService.class);

    public static final String FLEE_SKILL = "Flee";

    /** What the NPC ended up doing this tick */
    public enum NpcAction {
        FLED,
        ATTACKED,
        NO_TARGET,
        INCAPACITATED
    }

    private final CombatManager combatManager;
    private final CombatService combatService;
    private final GameEventPublisher publisher;
    private final double defaultFleeThreshold;
    private final int minFatigueForDodge;

    public NpcAiService(CombatManager combatManager, CombatService combatService,
                        GameEventPublisher publisher, CombatConfig config) {
        this.combatManager = combatManager;
        this.combatService = combatService;
        this.publisher = publisher;
        this.defaultFleeThreshold = config.getDefaultFleeThreshold();
        this.minFatigueForDodge = config.getMinFatigueForDodge();
    }

    public NpcAction decideAndAct(CombatSession session, Combatant npc) {
        ActionRestriction vitality = CombatantLocks.withLock(npc,
            () -> VitalityRules.evaluate(VitalityRules.availableVitality(npc)));
        if (!vitality.canAttempt()) {
            logger.debug("[NpcAiService] {} is too injured to act", npc.getName());
            return NpcAction.INCAPACITATED;
        }

        // Priority 1: flee when vitality is at or below the threshold
        if (shouldFlee(npc)) {
            logger.debug("[NpcAiService] {} attempting to flee (VIT {}/{})",
                npc.getName(), npc.getCurrentVitality(), npc.getMaxVitality());
            if (combatManager.fleeFromCombat(npc)) {
                publisher.publish(new CombatActionEvent(npc.getId(), npc.getName(), null, "",
                    session.getRoomId(), npc.getName() + " flees from combat!", 0, false, FLEE_SKILL));
                logger.info("[NpcAiService] {} fled from combat", npc.getName());
                return NpcAction.FLED;
            }
            logger.debug("[NpcAiService] {} failed to flee", npc.getName());
        }

        // Priority 2: defense mode
        boolean parry = shouldUseParryMode(npc);
        CombatParticipant self = session.findActiveParticipant(npc.getId());
        if (self != null && self.isParryMode() != parry) {
            combatManager.setParryMode(npc, parry);
            logger.debug("[NpcAiService] {} switched to {} mode", npc.getName(), parry ? "parry" : "dodge");
        }

        // Priority 3: attack a player
        Combatant target = selectTarget(session, npc);
        if (target == null) {
            logger.debug("[NpcAiService] {} has no valid targets", npc.getName());
            return NpcAction.NO_TARGET;
        }
        CombatResult result = combatService.performMeleeAttack(npc, target, false, false);
        logger.debug("[NpcAiService] {} attacked {}: {}", npc.getName(), target.getName(), result.getType());
        return NpcAction.ATTACKED;
    }

    public boolean shouldFlee(Combatant npc) {
        NpcBehavior behavior = behaviorOf(npc);
        if (behavior.isNeverFlee()) return false;
        double vitPercent = CombatantLocks.withLock(npc, () ->
            npc.getMaxVitality() > 0 ? (double) npc.getCurrentVitality() / npc.getMaxVitality() : 1.0);
        return vitPercent <= getFleeThreshold(npc);
    }

    public double getFleeThreshold(Combatant npc) {
        Double custom = behaviorOf(npc).getFleeThreshold();
        return custom != null ? custom : defaultFleeThreshold;
    }

    /** Parry costs no fatigue, so a tired NPC stops dodging. */
    public boolean shouldUseParryMode(Combatant npc) {
        return CombatantLocks.withLock(npc, npc::getCurrentFatigue) < minFatigueForDodge;
    }

    /** First player still fighting in the session, or null. */
    public Combatant selectTarget(CombatSession session, Combatant npc) {
        for (CombatParticipant p : session.getActiveParticipants()) {
            Combatant c = p.getCombatant();
            if (c.isPlayerControlled() && !c.getId().equals(npc.getId())) return c;
        }
        return null;
    }

    private static NpcBehavior behaviorOf(Combatant npc) {
        if (npc instanceof NpcSpawn) {
            return ((NpcSpawn) npc).getTemplate().getBehavior();
        }
        return NpcBehavior.DEFAULT;
    }
}
