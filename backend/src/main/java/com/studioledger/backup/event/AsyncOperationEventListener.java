package com.studioledger.backup.event;

import com.studioledger.backup.service.BackupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Starts background work once the transaction that requested it has committed,
 * so the worker always sees the rows it was asked to process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AsyncOperationEventListener {

    private final BackupService backupService;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleBackupRequested(BackupRequestedEvent event) {
        log.debug("Handling BackupRequestedEvent for backup: {}", event.getBackupId());
        backupService.executeBackupAsync(event.getBackupId());
    }
}
