package com.flagship.player_progression.loot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LootTableEntryRepository extends JpaRepository<LootTableEntryEntity, Long> {

    List<LootTableEntryEntity> findByLootTableIdOrderByIdAsc(Long lootTableId);

    Optional<LootTableEntryEntity> findByIdAndLootTableId(Long id, Long lootTableId);

    boolean existsByLootTableIdAndCosmeticId(Long lootTableId, Long cosmeticId);
}
