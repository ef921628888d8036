package org.town.core.generation;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public class StageProfile {
    private final Set<StageId> enabled;

    private StageProfile(Set<StageId> enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled(StageId id) {
        return enabled.contains(id);
    }

    public static StageProfile full() {
        return new StageProfile(EnumSet.allOf(StageId.class));
    }

    // Без автоматической сшивки: острова остаются как есть, VALIDATE их покажет
    public static StageProfile withoutRepair() {
        return new StageProfile(EnumSet.of(
                StageId.GROUND,
                StageId.ROADS,
                StageId.OBJECTS,
                StageId.VALIDATE
        ));
    }

    public static StageProfile groundAndRoads() {
        return new StageProfile(EnumSet.of(
                StageId.GROUND,
                StageId.ROADS,
                StageId.CONNECT_ROADS,
                StageId.VALIDATE
        ));
    }

    public static StageProfile byName(String name) {
        if (name == null || name.isBlank()) return full();
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "full" -> full();
            case "withoutrepair", "without-repair" -> withoutRepair();
            case "groundandroads", "ground-and-roads" -> groundAndRoads();
            default -> throw new IllegalArgumentException("Unknown stage profile: " + name);
        };
    }
}
