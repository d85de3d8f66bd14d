package com.studioledger.backup.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "backups")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Backup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String status = STATUS_PENDING;

    @Column(name = "file_name", length = 500)
    private String fileName;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(columnDefinition = "TEXT")
    private String manifest;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "triggered_by", nullable = false, length = 20)
    private String triggeredBy;

    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @OneToMany(mappedBy = "backup", cascade = CascadeType.REMOVE)
    @OrderBy("startedAt ASC")
    @Builder.Default
    private List<BackupUpload> uploads = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Moves the backup to a later lifecycle state. Terminal states never change and
     * running never goes back to pending.
     *
     * @throws IllegalStateException if the transition would regress the status
     */
    public void transitionTo(String newStatus) {
        if (!canTransition(status, newStatus)) {
            throw new IllegalStateException(
                    "Backup " + id + " cannot move from " + status + " to " + newStatus);
        }
        this.status = newStatus;
    }

    public boolean isTerminal() {
        return TERMINAL_STATUSES.contains(status);
    }

    /**
     * True when the archive reached at least one destination.
     */
    public boolean hasRemoteCopy() {
        return STATUS_COMPLETED.equals(status) || STATUS_PARTIAL.equals(status);
    }

    static boolean canTransition(String from, String to) {
        if (TERMINAL_STATUSES.contains(from)) {
            return false;
        }
        if (STATUS_PENDING.equals(from)) {
            return STATUS_RUNNING.equals(to) || TERMINAL_STATUSES.contains(to);
        }
        return STATUS_RUNNING.equals(from) && TERMINAL_STATUSES.contains(to);
    }

    // Backup statuses
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_PARTIAL = "partial";
    public static final String STATUS_FAILED = "failed";

    private static final Set<String> TERMINAL_STATUSES =
            Set.of(STATUS_COMPLETED, STATUS_PARTIAL, STATUS_FAILED);

    // Trigger sources
    public static final String TRIGGERED_BY_MANUAL = "manual";
    public static final String TRIGGERED_BY_SCHEDULED = "scheduled";

    // Provider label used when a run targets more than one destination
    public static final String PROVIDER_MULTI = "multi";
}
