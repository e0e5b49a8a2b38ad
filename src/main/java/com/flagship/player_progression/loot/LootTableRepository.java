package com.flagship.player_progression.loot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LootTableRepository extends JpaRepository<LootTableEntity, Long> {

    /**
     * Active tables in the stable order the drop roll walks them.
     */
    List<LootTableEntity> findByActiveTrueOrderByIdAsc();

    List<LootTableEntity> findAllByOrderByIdAsc();
}
