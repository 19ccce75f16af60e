package com.example.mordecai;

import com.example.mordecai.combat.CombatCalculator;
import com.example.mordecai.model.ArmorProperties;
import com.example.mordecai.model.DamageClass;
import com.example.mordecai.model.DamageType;
import com.example.mordecai.model.EquipmentSlot;
import com.example.mordecai.model.EquippedItem;
import com.example.mordecai.model.HitLocation;
import com.example.mordecai.util.FudgeDice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the fixed melee tables.
 */
@DisplayName("CombatCalculator Tests")
public class CombatCalculatorTest {

    private static EquippedItem armor(String name, EquipmentSlot slot, int absorb, DamageClass cls,
                                      String coverage, int layer) {
        return EquippedItem.armor(name, slot,
            new ArmorProperties(cls, Map.of(DamageType.CUTTING, absorb), 0, coverage, layer));
    }

    @ParameterizedTest
    @CsvSource({
        "-5, 0", "1, 0", "2, 1", "3, 1", "4, 2", "7, 2", "8, 3", "11, 3", "12, 4", "30, 4"
    })
    void testResultValueBonus(int rv, int expected) {
        assertEquals(expected, CombatCalculator.resultValueBonus(rv));
    }

    @ParameterizedTest
    @CsvSource({
        "-12, -3, 3", "-9, -3, 3", "-8, -2, 2", "-7, -2, 2", "-6, -2, 1", "-5, -2, 1", "-4, -1, 1", "-3, -1, 1"
    })
    void testPenaltySeverity(int value, int amount, int rounds) {
        CombatCalculator.PenaltySeverity s = CombatCalculator.penaltySeverity(value);
        assertNotNull(s);
        assertEquals(amount, s.amount());
        assertEquals(rounds, s.rounds());
    }

    @Test
    void testPenaltySeverity_mildValuesHaveNone() {
        assertNull(CombatCalculator.penaltySeverity(-2));
        assertNull(CombatCalculator.penaltySeverity(0));
        assertNull(CombatCalculator.penaltySeverity(5));
    }

    @ParameterizedTest
    @CsvSource({
        "2, TORSO", "6, TORSO", "7, LEFT_ARM", "8, RIGHT_ARM", "9, LEFT_LEG", "10, LEFT_LEG", "11, RIGHT_LEG", "12, RIGHT_LEG"
    })
    void testHitLocation_singleRoll(int face, HitLocation expected) {
        FudgeDice dice = new FudgeDice(new ScriptedRandom().face(face), 20);
        assertEquals(expected, CombatCalculator.rollHitLocation(dice));
    }

    @Test
    @DisplayName("Head is only reachable through the second d12")
    void testHitLocation_headSubRoll() {
        FudgeDice head = new FudgeDice(new ScriptedRandom().face(1).face(6), 20);
        assertEquals(HitLocation.HEAD, CombatCalculator.rollHitLocation(head));
        FudgeDice torso = new FudgeDice(new ScriptedRandom().face(1).face(7), 20);
        assertEquals(HitLocation.TORSO, CombatCalculator.rollHitLocation(torso));
    }

    @ParameterizedTest
    @CsvSource({
        "0, 0, 0, 0", "4, 4, 0, 0", "5, 5, 1, 0", "6, 6, 2, 0", "7, 7, 4, 1", "8, 8, 6, 1", "9, 9, 8, 1",
        "10, 10, 10, 2", "11, 11, 11, 2", "14, 14, 14, 2", "15, 15, 15, 3", "16, 16, 16, 3",
        "20, 20, 20, 3", "21, 21, 21, 4", "36, 36, 36, 7"
    })
    void testSplitDamage(int damage, int fatigue, int vitality, int wounds) {
        CombatCalculator.DamageSplit split = CombatCalculator.splitDamage(damage);
        assertEquals(fatigue, split.fatigue());
        assertEquals(vitality, split.vitality());
        assertEquals(wounds, split.wounds());
    }

    @Test
    @DisplayName("Mitigated SV never increases with absorption and never goes negative")
    void testMitigate_monotonic() {
        for (int sv = 0; sv <= 20; sv++) {
            int previous = Integer.MAX_VALUE;
            for (int absorb = 0; absorb <= 25; absorb++) {
                int m = CombatCalculator.mitigate(sv, absorb);
                assertTrue(m >= 0);
                assertTrue(m <= previous);
                previous = m;
            }
        }
    }

    @Test
    @DisplayName("Higher weapon class strips a point of absorption per tier")
    void testAbsorption_classBypass() {
        EquippedItem leather = armor("leather jerkin", EquipmentSlot.CHEST, 3, DamageClass.CLASS_1, null, 0);
        assertEquals(3, CombatCalculator.absorption(leather, DamageType.CUTTING, DamageClass.CLASS_1));
        assertEquals(1, CombatCalculator.absorption(leather, DamageType.CUTTING, DamageClass.CLASS_3));
        assertEquals(0, CombatCalculator.absorption(leather, DamageType.CUTTING, DamageClass.CLASS_4));
        assertEquals(0, CombatCalculator.absorption(leather, DamageType.BASHING, DamageClass.CLASS_1));
    }

    @Test
    @DisplayName("Only intact armor covering the location counts, in layer order")
    void testArmorCovering() {
        EquippedItem plate = armor("breastplate", EquipmentSlot.CHEST, 4, DamageClass.CLASS_2, null, 2);
        EquippedItem gambeson = armor("gambeson", EquipmentSlot.BACK, 2, DamageClass.CLASS_1, "torso, arms", 1);
        EquippedItem helm = armor("helm", EquipmentSlot.HEAD, 3, DamageClass.CLASS_2, null, 0);
        EquippedItem brokenGreaves = armor("greaves", EquipmentSlot.LEGS, 3, DamageClass.CLASS_2, null, 0);
        brokenGreaves.setBroken(true);
        List<EquippedItem> gear = List.of(plate, gambeson, helm, brokenGreaves);

        List<EquippedItem> torso = CombatCalculator.armorCovering(gear, HitLocation.TORSO);
        assertEquals(List.of(gambeson, plate), torso);
        assertEquals(List.of(gambeson), CombatCalculator.armorCovering(gear, HitLocation.LEFT_ARM));
        assertTrue(CombatCalculator.armorCovering(gear, HitLocation.LEFT_LEG).isEmpty());

        assertEquals(6, CombatCalculator.totalAbsorption(gear, HitLocation.TORSO, DamageType.CUTTING, DamageClass.CLASS_1));
        assertEquals(5, CombatCalculator.totalAbsorption(gear, HitLocation.TORSO, DamageType.CUTTING, DamageClass.CLASS_2));
    }

    @Test
    void testRollRawDamage_table() {
        assertEquals(2, CombatCalculator.rollRawDamage(0, new FudgeDice(new ScriptedRandom().face(6), 20)));
        assertEquals(1, CombatCalculator.rollRawDamage(1, new FudgeDice(new ScriptedRandom().face(3), 20)));
        assertEquals(7, CombatCalculator.rollRawDamage(3, new FudgeDice(new ScriptedRandom().face(7), 20)));
        assertEquals(9, CombatCalculator.rollRawDamage(6, new FudgeDice(new ScriptedRandom().face(4).face(5), 20)));
        assertEquals(4 * 10, CombatCalculator.rollRawDamage(13, new FudgeDice(new ScriptedRandom().face(10).face(10).face(10).face(10), 20)));
        assertEquals(30, CombatCalculator.rollRawDamage(15, new FudgeDice(new ScriptedRandom().face(3), 20)));
    }

    @Test
    void testScaleDamage() {
        assertEquals(10, CombatCalculator.scaleDamage(10, 0.0, 0.0));
        assertEquals(7, CombatCalculator.scaleDamage(10, -0.25, 0.0));
        assertEquals(5, CombatCalculator.scaleDamage(10, -0.25, -0.20));
        assertEquals(0, CombatCalculator.scaleDamage(10, -1.0, -0.5));
    }
}
