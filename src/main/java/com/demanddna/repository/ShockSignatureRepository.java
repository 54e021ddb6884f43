package com.demanddna.repository;

import com.demanddna.entity.ShockSignatureRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ShockSignatureRepository extends JpaRepository<ShockSignatureRecord, UUID> {

    List<ShockSignatureRecord> findAllByOrderByCreatedAtDesc();
}
