package com.studioledger.backup.repository;

import com.studioledger.backup.model.entity.BackupUpload;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BackupUploadRepository extends JpaRepository<BackupUpload, UUID> {

    List<BackupUpload> findByBackupId(UUID backupId);

    List<BackupUpload> findByBackupIdAndStatus(UUID backupId, String status);
}
