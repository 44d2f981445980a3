package nl.bytesoflife.circuitsync.model;

import java.util.Set;

/**
 * Names treated as global power nets when a description does not say otherwise.
 */
public final class PowerNets {

    private static final Set<String> NAMES = Set.of(
            "VCC", "VDD", "VSS", "GND", "GNDA", "GNDD",
            "+3V3", "+5V", "+12V", "-12V", "+15V", "-15V");

    private PowerNets() {
    }

    public static boolean isGlobalName(String name) {
        if (name == null || name.isEmpty()) return false;
        return NAMES.contains(name.toUpperCase()) || name.startsWith("+") || name.startsWith("-");
    }
}
