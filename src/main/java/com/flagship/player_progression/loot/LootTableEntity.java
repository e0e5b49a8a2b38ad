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

import java.time.Instant;

@Entity
@Table(name = "loot_tables")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LootTableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "loot_table_id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "drop_chance", nullable = false)
    private double dropChance;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static LootTableEntity create(String name, String description, double dropChance, boolean active) {
        LootTableEntity entity = new LootTableEntity();
        Instant now = Instant.now();
        entity.name = name;
        entity.description = description;
        entity.dropChance = dropChance;
        entity.active = active;
        entity.createdAt = now;
        entity.updatedAt = now;
        return entity;
    }

    void update(String name, String description, double dropChance, boolean active) {
        this.name = name;
        this.description = description;
        this.dropChance = dropChance;
        this.active = active;
        this.updatedAt = Instant.now();
    }

    public LootTable toDomain() {
        return new LootTable(id, name, description, dropChance, active, createdAt, updatedAt);
    }
}
