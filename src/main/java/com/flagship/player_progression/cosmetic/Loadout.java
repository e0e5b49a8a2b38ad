package com.flagship.player_progression.cosmetic;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A named set of equipped cosmetics. Exactly one of a player's loadouts is active.
 */
@Value
public class Loadout {
    Long loadoutId;
    Long playerId;
    String name;
    boolean active;
    Instant createdAt;
    List<SlotAssignment> assignments;

    public Optional<Long> cosmeticInSlot(CosmeticSlot slot) {
        return assignments.stream()
                .filter(assignment -> assignment.getSlot() == slot)
                .map(SlotAssignment::getCosmeticId)
                .findFirst();
    }

    Loadout withAssignments(List<SlotAssignment> newAssignments) {
        return new Loadout(loadoutId, playerId, name, active, createdAt, List.copyOf(newAssignments));
    }

    @Value
    public static class SlotAssignment {
        CosmeticSlot slot;
        Long cosmeticId;
        Instant assignedAt;
    }
}
