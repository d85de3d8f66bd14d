package com.studioledger.backup.repository;

import com.studioledger.backup.model.entity.Backup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BackupRepository extends JpaRepository<Backup, UUID> {

    List<Backup> findTop50ByOrderByCreatedAtDesc();

    List<Backup> findByStatusOrderByCreatedAtDesc(String status);
}
