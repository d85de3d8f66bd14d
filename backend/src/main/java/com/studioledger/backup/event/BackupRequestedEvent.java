package com.studioledger.backup.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a backup run and its upload rows have been created.
 * Handled after the creating transaction commits.
 */
@Getter
public class BackupRequestedEvent extends ApplicationEvent {

    private final UUID backupId;

    public BackupRequestedEvent(Object source, UUID backupId) {
        super(source);
        this.backupId = backupId;
    }
}
