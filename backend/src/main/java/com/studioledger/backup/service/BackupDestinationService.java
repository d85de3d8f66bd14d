package com.studioledger.backup.service;

import com.studioledger.backup.exception.ApiException;
import com.studioledger.backup.model.dto.DestinationRequest;
import com.studioledger.backup.model.dto.DestinationResponse;
import com.studioledger.backup.model.dto.TestConnectionRequest;
import com.studioledger.backup.model.entity.BackupDestination;
import com.studioledger.backup.repository.BackupDestinationRepository;
import com.studioledger.backup.storage.BackupStorageProvider;
import com.studioledger.backup.storage.ConnectionTestResult;
import com.studioledger.backup.storage.StorageProviderFactory;
import com.studioledger.backup.storage.StorageProviderType;
import com.studioledger.backup.util.CredentialUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin management of backup destinations. Every read masks secrets and every update
 * merges submitted credentials into the stored ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupDestinationService {

    private final BackupDestinationRepository destinationRepository;
    private final StorageProviderFactory storageProviderFactory;

    @Transactional(readOnly = true)
    public List<DestinationResponse> listDestinations() {
        return destinationRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(DestinationResponse::fromEntity)
                .toList();
    }

    @Transactional(readOnly = true)
    public DestinationResponse getDestination(UUID id) {
        return DestinationResponse.fromEntity(findDestination(id));
    }

    @Transactional
    public DestinationResponse createDestination(DestinationRequest request) {
        StorageProviderType type = StorageProviderType.fromName(request.getProvider());
        Map<String, String> credentials = CredentialUtils.sanitizeCredentials(type.getProviderName(), request.getCredentials());
        requireCredentials(type, credentials);

        BackupDestination destination = BackupDestination.builder()
                .name(request.getName().trim())
                .provider(type.getProviderName())
                .credentials(credentials)
                .active(request.getActive() == null || request.getActive())
                .build();
        destination = destinationRepository.save(destination);

        log.info("Backup destination '{}' created ({})", destination.getName(), destination.getProvider());
        return DestinationResponse.fromEntity(destination);
    }

    /**
     * Update a destination. Masked secrets keep their stored value; switching provider
     * discards the old credentials, so masked values cannot carry over.
     */
    @Transactional
    public DestinationResponse updateDestination(UUID id, DestinationRequest request) {
        BackupDestination destination = findDestination(id);
        StorageProviderType type = StorageProviderType.fromName(request.getProvider());

        Map<String, String> existing = type.getProviderName().equals(destination.getProvider())
                ? destination.getCredentials()
                : Map.of();
        Map<String, String> merged = CredentialUtils.mergeCredentials(existing, request.getCredentials(), type.getProviderName());
        requireCredentials(type, merged);

        destination.setName(request.getName().trim());
        destination.setProvider(type.getProviderName());
        destination.setCredentials(merged);
        if (request.getActive() != null) {
            destination.setActive(request.getActive());
        }
        destination = destinationRepository.save(destination);

        log.info("Backup destination '{}' updated", destination.getName());
        return DestinationResponse.fromEntity(destination);
    }

    /**
     * Delete a destination. Its upload history rows are removed with it.
     */
    @Transactional
    public void deleteDestination(UUID id) {
        BackupDestination destination = findDestination(id);
        destinationRepository.delete(destination);
        log.info("Backup destination '{}' deleted", destination.getName());
    }

    @Transactional
    public DestinationResponse toggleActive(UUID id) {
        BackupDestination destination = findDestination(id);
        destination.setActive(!destination.isActive());
        destination = destinationRepository.save(destination);
        log.info("Backup destination '{}' is now {}", destination.getName(), destination.isActive() ? "active" : "inactive");
        return DestinationResponse.fromEntity(destination);
    }

    @Transactional(readOnly = true)
    public ConnectionTestResult testDestination(UUID id) {
        BackupDestination destination = findDestination(id);
        return testConnection(destination.getProvider(), destination.getCredentials());
    }

    /**
     * Test credentials from a form. A form showing masked secrets was loaded from a saved
     * destination, so that destination's stored credentials are merged in first.
     */
    @Transactional(readOnly = true)
    public ConnectionTestResult testUnsaved(TestConnectionRequest request) {
        Map<String, String> credentials = request.getCredentials();
        if (CredentialUtils.containsMask(credentials)) {
            if (request.getDestinationId() == null) {
                return ConnectionTestResult.failed("Saved credentials are masked; select the destination to test it");
            }
            BackupDestination saved = findDestination(request.getDestinationId());
            if (!saved.getProvider().equals(StorageProviderType.fromName(request.getProvider()).getProviderName())) {
                return ConnectionTestResult.failed("Masked credentials belong to a different provider");
            }
            credentials = CredentialUtils.mergeCredentials(saved.getCredentials(), credentials, saved.getProvider());
        }
        return testConnection(request.getProvider(), credentials);
    }

    /**
     * Try to reach a provider. Configuration and connectivity problems both come back as a
     * failed result rather than an exception.
     */
    public ConnectionTestResult testConnection(String provider, Map<String, String> credentials) {
        try (BackupStorageProvider storage = storageProviderFactory.create(provider, credentials)) {
            return storage.testConnection();
        } catch (Exception e) {
            log.debug("Connection test for {} failed: {}", provider, e.getMessage());
            return ConnectionTestResult.failed(e.getMessage() != null ? e.getMessage() : "Connection test failed");
        }
    }

    private BackupDestination findDestination(UUID id) {
        return destinationRepository.findById(id)
                .orElseThrow(() -> new ApiException("Destination not found", HttpStatus.NOT_FOUND));
    }

    private static void requireCredentials(StorageProviderType type, Map<String, String> credentials) {
        for (String key : type.getRequiredKeys()) {
            String value = credentials.get(key);
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Missing required credential: " + key);
            }
        }
    }
}
