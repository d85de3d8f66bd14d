package com.studioledger.backup.repository;

import com.studioledger.backup.model.entity.BackupDestination;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BackupDestinationRepository extends JpaRepository<BackupDestination, UUID> {

    List<BackupDestination> findAllByOrderByCreatedAtAsc();

    List<BackupDestination> findByActiveTrueOrderByCreatedAtAsc();
}
