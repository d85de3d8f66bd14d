package com.studioledger.backup.service;

import com.studioledger.backup.model.dto.BackupSettings;
import com.studioledger.backup.model.entity.Backup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the single recurring backup trigger and converts manual and scheduled
 * requests into backup runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupScheduler {

    public static final String JOB_NAME = "scheduled-backup";

    static final String DAILY_CRON = "0 0 2 * * *";
    static final String WEEKLY_CRON = "0 0 2 * * SUN";

    private final BackupService backupService;
    private final AppSettingsService appSettingsService;

    @Qualifier("backupTaskScheduler")
    private final TaskScheduler backupTaskScheduler;

    private ScheduledFuture<?> scheduledJob;
    private String activeCron;

    @EventListener(ApplicationReadyEvent.class)
    public void restoreSchedule() {
        applySchedule(appSettingsService.loadBackupSettings().getSchedule());
    }

    /**
     * Replace the recurring trigger: daily and weekly run at 02:00 (weekly on Sunday);
     * any other value removes it. Removing an absent trigger is a no-op.
     */
    public synchronized void applySchedule(String schedule) {
        String cron = cronFor(schedule);

        if (scheduledJob != null) {
            scheduledJob.cancel(false);
            scheduledJob = null;
            activeCron = null;
        }

        if (cron == null) {
            log.info("Backup schedule '{}' removed", JOB_NAME);
            return;
        }

        scheduledJob = backupTaskScheduler.schedule(this::runScheduledBackup, new CronTrigger(cron));
        activeCron = cron;
        log.info("Backup schedule '{}' set to {} ({})", JOB_NAME, schedule, cron);
    }

    /**
     * Queue a one-off run for a user. The run itself happens in the background.
     */
    public UUID triggerManualBackup(UUID userId) {
        return backupService.triggerBackup(Backup.TRIGGERED_BY_MANUAL, userId).getId();
    }

    void runScheduledBackup() {
        try {
            Backup backup = backupService.triggerBackup(Backup.TRIGGERED_BY_SCHEDULED, null);
            log.info("Scheduled backup {} queued", backup.getId());
        } catch (IllegalStateException e) {
            log.warn("Scheduled backup skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled backup could not be queued: {}", e.getMessage(), e);
        }
    }

    public synchronized String getActiveCron() {
        return activeCron;
    }

    static String cronFor(String schedule) {
        if (BackupSettings.SCHEDULE_DAILY.equals(schedule)) {
            return DAILY_CRON;
        }
        if (BackupSettings.SCHEDULE_WEEKLY.equals(schedule)) {
            return WEEKLY_CRON;
        }
        return null;
    }
}
