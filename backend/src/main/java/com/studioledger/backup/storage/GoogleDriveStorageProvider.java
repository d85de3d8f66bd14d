package com.studioledger.backup.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.studioledger.backup.client.GoogleOAuthClient;
import com.studioledger.backup.exception.StorageProviderException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.*;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage provider backed by a Google Drive folder, authorized with an OAuth refresh token.
 * Talks to the Drive v3 REST API directly. The access token obtained from the refresh
 * token is cached on the instance until shortly before it expires.
 */
@Slf4j
public class GoogleDriveStorageProvider implements BackupStorageProvider {

    static final String FILES_URL = "https://www.googleapis.com/drive/v3/files";
    static final String UPLOAD_URL = "https://www.googleapis.com/upload/drive/v3/files";
    static final String ARCHIVE_NAME_MARKER = "backup-";

    private static final Duration TOKEN_EXPIRY_MARGIN = Duration.ofSeconds(60);
    private static final MediaType ARCHIVE_MEDIA_TYPE = MediaType.parseMediaType("application/gzip");

    private final RestTemplate restTemplate;
    private final GoogleOAuthClient oauthClient;
    private final String clientId;
    private final String clientSecret;
    private final String refreshToken;
    private final String folderId;
    private final Clock clock;

    private String accessToken;
    private Instant accessTokenExpiresAt;

    public GoogleDriveStorageProvider(RestTemplate restTemplate, GoogleOAuthClient oauthClient,
                                      String clientId, String clientSecret,
                                      String refreshToken, String folderId, Clock clock) {
        this.restTemplate = restTemplate;
        this.oauthClient = oauthClient;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.refreshToken = refreshToken;
        this.folderId = folderId;
        this.clock = clock;
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            listFiles("'" + escape(folderId) + "' in parents and trashed = false", 1);
            return ConnectionTestResult.ok("Successfully connected to Google Drive folder");
        } catch (Exception e) {
            log.debug("Connection test for Drive folder {} failed: {}", folderId, e.getMessage());
            return ConnectionTestResult.failed(e.getMessage() != null
                    ? e.getMessage()
                    : "Failed to connect to Google Drive");
        }
    }

    @Override
    public List<StorageObject> list() {
        String query = "'" + escape(folderId) + "' in parents and name contains '"
                + ARCHIVE_NAME_MARKER + "' and trashed = false";
        return listFiles(query, 1000).stream()
                .map(file -> StorageObject.builder()
                        .key(file.getName())
                        .size(file.getSize() != null ? Long.parseLong(file.getSize()) : 0L)
                        .lastModified(file.getModifiedTime() != null ? Instant.parse(file.getModifiedTime()) : null)
                        .build())
                .toList();
    }

    @Override
    public void upload(Path localPath, String remoteKey) {
        String name = driveFileName(remoteKey);
        // Drive allows duplicate names; the old copy is removed only once the new one is stored
        Optional<String> previous = findFileId(name);

        try {
            HttpHeaders sessionHeaders = authorizedHeaders();
            sessionHeaders.setContentType(MediaType.APPLICATION_JSON);
            sessionHeaders.set("X-Upload-Content-Type", ARCHIVE_MEDIA_TYPE.toString());
            sessionHeaders.set("X-Upload-Content-Length", String.valueOf(Files.size(localPath)));

            Map<String, Object> metadata = Map.of("name", name, "parents", List.of(folderId));
            ResponseEntity<Void> session = restTemplate.exchange(
                    URI.create(UPLOAD_URL + "?uploadType=resumable"),
                    HttpMethod.POST,
                    new HttpEntity<>(metadata, sessionHeaders),
                    Void.class);

            URI location = session.getHeaders().getLocation();
            if (location == null) {
                throw new StorageProviderException("Google Drive did not return an upload session for " + name);
            }

            HttpHeaders contentHeaders = authorizedHeaders();
            contentHeaders.setContentType(ARCHIVE_MEDIA_TYPE);
            restTemplate.exchange(location, HttpMethod.PUT,
                    new HttpEntity<>(new FileSystemResource(localPath), contentHeaders), String.class);
            log.debug("Uploaded {} to Drive folder {}", name, folderId);
            previous.ifPresent(this::deleteFile);
        } catch (IOException e) {
            throw new StorageProviderException("Cannot read archive " + localPath, e);
        } catch (RestClientException e) {
            throw new StorageProviderException("Failed to upload " + name + " to Google Drive: " + e.getMessage(), e);
        }
    }

    @Override
    public void download(String remoteKey, Path localPath) {
        String name = driveFileName(remoteKey);
        String fileId = findFileId(name)
                .orElseThrow(() -> new StorageProviderException("File not found in Google Drive: " + name));

        URI uri = UriComponentsBuilder.fromHttpUrl(FILES_URL)
                .pathSegment(fileId)
                .queryParam("alt", "media")
                .build()
                .toUri();
        String token = currentAccessToken();
        try {
            restTemplate.execute(uri, HttpMethod.GET,
                    request -> request.getHeaders().setBearerAuth(token),
                    response -> {
                        try (InputStream body = response.getBody()) {
                            Files.copy(body, localPath, StandardCopyOption.REPLACE_EXISTING);
                        }
                        return null;
                    });
            log.debug("Downloaded {} from Drive folder {}", name, folderId);
        } catch (RestClientException e) {
            throw new StorageProviderException("Failed to download " + name + " from Google Drive: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String remoteKey) {
        String name = driveFileName(remoteKey);
        String fileId = findFileId(name)
                .orElseThrow(() -> new StorageProviderException("File not found in Google Drive: " + name));
        deleteFile(fileId);
    }

    @Override
    public void close() {
        accessToken = null;
        accessTokenExpiresAt = null;
    }

    /**
     * Return a valid access token, refreshing it when missing or about to expire.
     */
    synchronized String currentAccessToken() {
        Instant now = clock.instant();
        if (accessToken == null || accessTokenExpiresAt == null
                || !now.plus(TOKEN_EXPIRY_MARGIN).isBefore(accessTokenExpiresAt)) {
            GoogleOAuthClient.TokenResponse token;
            try {
                token = oauthClient.refreshAccessToken(clientId, clientSecret, refreshToken);
            } catch (RestClientException e) {
                throw new StorageProviderException("Failed to refresh Google access token: " + e.getMessage(), e);
            }
            long expiresIn = token.getExpiresIn() != null ? token.getExpiresIn() : 3600L;
            accessToken = token.getAccessToken();
            accessTokenExpiresAt = now.plusSeconds(expiresIn);
        }
        return accessToken;
    }

    private List<DriveFile> listFiles(String query, int pageSize) {
        URI uri = UriComponentsBuilder.fromHttpUrl(FILES_URL)
                .queryParam("q", query)
                .queryParam("fields", "files(id,name,size,modifiedTime)")
                .queryParam("orderBy", "modifiedTime desc")
                .queryParam("pageSize", pageSize)
                .encode()
                .build()
                .toUri();
        try {
            ResponseEntity<DriveFileList> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(authorizedHeaders()), DriveFileList.class);
            DriveFileList body = response.getBody();
            return body != null && body.getFiles() != null ? body.getFiles() : List.of();
        } catch (RestClientException e) {
            throw new StorageProviderException("Failed to list Google Drive folder: " + e.getMessage(), e);
        }
    }

    private Optional<String> findFileId(String name) {
        String query = "'" + escape(folderId) + "' in parents and name = '" + escape(name) + "' and trashed = false";
        return listFiles(query, 1).stream()
                .map(DriveFile::getId)
                .findFirst();
    }

    private void deleteFile(String fileId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(FILES_URL)
                .pathSegment(fileId)
                .build()
                .toUri();
        try {
            restTemplate.exchange(uri, HttpMethod.DELETE, new HttpEntity<>(authorizedHeaders()), Void.class);
        } catch (RestClientException e) {
            throw new StorageProviderException("Failed to delete Google Drive file " + fileId + ": " + e.getMessage(), e);
        }
    }

    private HttpHeaders authorizedHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(currentAccessToken());
        return headers;
    }

    /**
     * Drive has no key hierarchy; files are stored flat in the folder under the last key segment.
     */
    static String driveFileName(String remoteKey) {
        int slash = remoteKey.lastIndexOf('/');
        return slash >= 0 ? remoteKey.substring(slash + 1) : remoteKey;
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DriveFileList {
        private List<DriveFile> files;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DriveFile {
        private String id;
        private String name;
        private String size;
        private String modifiedTime;
    }
}
