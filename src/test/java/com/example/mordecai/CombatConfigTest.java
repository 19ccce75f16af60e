package com.example.mordecai;

import com.example.mordecai.config.CombatConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CombatConfig Tests")
public class CombatConfigTest {

    @Test
    void testDefaults() {
        CombatConfig config = CombatConfig.defaults();
        assertEquals(3000L, config.getHealthTickMillis());
        assertEquals(1000L, config.getEffectTickMillis());
        assertEquals(3000L, config.getRoundMillis());
        assertEquals(3_600_000L, config.getPassiveVitalityRegenMillis());
        assertEquals(4 * 3_600_000L, config.getWoundHealIntervalMillis());
        assertEquals(0.25, config.getDefaultFleeThreshold(), 1e-9);
        assertEquals(3, config.getMinFatigueForDodge());
        assertEquals(20, config.getMaxExplosionRerolls());
    }

    @Test
    @DisplayName("Bundled combat.yaml matches the defaults")
    void testLoadBundled() {
        CombatConfig config = CombatConfig.load();
        assertEquals(3000L, config.getHealthTickMillis());
        assertEquals(3, config.getRoundSeconds());
        assertEquals(4, config.getWoundHealIntervalHours());
        assertEquals(20, config.getMaxExplosionRerolls());
    }

    @Test
    @DisplayName("String values are parsed, bad values fall back")
    void testFromMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("healthTickMillis", "1500");
        map.put("roundSeconds", 5);
        map.put("defaultFleeThreshold", "0.4");
        map.put("minFatigueForDodge", "lots");
        CombatConfig config = CombatConfig.fromMap(map);

        assertEquals(1500L, config.getHealthTickMillis());
        assertEquals(5000L, config.getRoundMillis());
        assertEquals(0.4, config.getDefaultFleeThreshold(), 1e-9);
        assertEquals(3, config.getMinFatigueForDodge());
        assertEquals(1000L, config.getEffectTickMillis());
    }

    @Test
    void testMissingResource() {
        CombatConfig config = CombatConfig.load("/config/missing.yaml");
        assertEquals(3000L, config.getHealthTickMillis());
        assertEquals(0.25, CombatConfig.fromMap(null).getDefaultFleeThreshold(), 1e-9);
    }
}
