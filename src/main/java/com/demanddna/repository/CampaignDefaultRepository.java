package com.demanddna.repository;

import com.demanddna.engine.ShockShape;
import com.demanddna.entity.CampaignDefault;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CampaignDefaultRepository extends JpaRepository<CampaignDefault, UUID> {

    Optional<CampaignDefault> findByEntityAndShape(String entity, ShockShape shape);

    List<CampaignDefault> findByEntity(String entity);

    List<CampaignDefault> findAllByOrderByEntityAscShapeAsc();
}
