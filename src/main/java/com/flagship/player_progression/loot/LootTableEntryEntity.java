package com.flagship.player_progression.loot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "loot_table_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LootTableEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "entry_id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "loot_table_id", nullable = false, updatable = false)
    private Long lootTableId;

    @Column(name = "cosmetic_id", nullable = false)
    private Long cosmeticId;

    @Column(name = "weight", nullable = false)
    private int weight;

    @Column(name = "min_quantity", nullable = false)
    private int minQuantity;

    @Column(name = "max_quantity", nullable = false)
    private int maxQuantity;

    static LootTableEntryEntity create(Long lootTableId, Long cosmeticId, int weight,
                                       int minQuantity, int maxQuantity) {
        LootTableEntryEntity entity = new LootTableEntryEntity();
        entity.lootTableId = lootTableId;
        entity.cosmeticId = cosmeticId;
        entity.weight = weight;
        entity.minQuantity = minQuantity;
        entity.maxQuantity = maxQuantity;
        return entity;
    }

    void update(Long cosmeticId, int weight, int minQuantity, int maxQuantity) {
        this.cosmeticId = cosmeticId;
        this.weight = weight;
        this.minQuantity = minQuantity;
        this.maxQuantity = maxQuantity;
    }

    public LootTableEntry toDomain() {
        return new LootTableEntry(id, lootTableId, cosmeticId, weight, minQuantity, maxQuantity);
    }
}
