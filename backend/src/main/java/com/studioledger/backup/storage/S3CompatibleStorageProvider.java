package com.studioledger.backup.storage;

import com.studioledger.backup.exception.StorageProviderException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.*;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Storage provider for AWS S3 and S3-compatible services (Backblaze B2, MinIO, etc.).
 * Archives live under the {@code backups/} prefix of the bucket.
 */
@Slf4j
public class S3CompatibleStorageProvider implements BackupStorageProvider {

    static final String BACKUP_PREFIX = "backups/";
    static final String ARCHIVE_SUFFIX = ".tar.gz";

    private final S3Client s3Client;
    private final String bucket;

    S3CompatibleStorageProvider(S3Client s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    /**
     * Build a provider with its own client. A custom endpoint switches the client to
     * path-style addressing, which S3-compatible services require.
     */
    public static S3CompatibleStorageProvider create(String accessKeyId, String secretAccessKey,
                                                     String bucket, String region, String endpoint) {
        AwsBasicCredentials credentials = AwsBasicCredentials.create(accessKeyId, secretAccessKey);

        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of(region));

        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint))
                    .forcePathStyle(true);
        }

        return new S3CompatibleStorageProvider(builder.build(), bucket);
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return ConnectionTestResult.ok("Successfully connected to bucket \"" + bucket + "\"");
        } catch (Exception e) {
            log.debug("Connection test for bucket {} failed: {}", bucket, e.getMessage());
            return ConnectionTestResult.failed(e.getMessage() != null
                    ? e.getMessage()
                    : "Failed to connect to bucket \"" + bucket + "\"");
        }
    }

    @Override
    public List<StorageObject> list() {
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(BACKUP_PREFIX)
                    .build();

            return s3Client.listObjectsV2Paginator(request).contents().stream()
                    .filter(object -> object.key() != null && object.key().endsWith(ARCHIVE_SUFFIX))
                    .map(object -> StorageObject.builder()
                            .key(object.key())
                            .size(object.size() != null ? object.size() : 0L)
                            .lastModified(object.lastModified())
                            .build())
                    .toList();
        } catch (SdkException e) {
            throw new StorageProviderException("Failed to list backups in bucket " + bucket + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void upload(Path localPath, String remoteKey) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(remoteKey)
                    .contentType("application/gzip")
                    .build();

            s3Client.putObject(request, RequestBody.fromFile(localPath));
            log.debug("Uploaded {} to bucket {}", remoteKey, bucket);
        } catch (SdkException e) {
            throw new StorageProviderException("Failed to upload " + remoteKey + " to bucket " + bucket + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void download(String remoteKey, Path localPath) {
        try {
            // The SDK file transformer refuses to overwrite an existing file
            Files.deleteIfExists(localPath);
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(remoteKey)
                    .build();

            s3Client.getObject(request, ResponseTransformer.toFile(localPath));
            log.debug("Downloaded {} from bucket {}", remoteKey, bucket);
        } catch (NoSuchKeyException e) {
            throw new StorageProviderException("Backup not found in bucket " + bucket + ": " + remoteKey, e);
        } catch (SdkException e) {
            throw new StorageProviderException("Failed to download " + remoteKey + " from bucket " + bucket + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StorageProviderException("Cannot write download target " + localPath, e);
        }
    }

    @Override
    public void delete(String remoteKey) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(remoteKey)
                    .build());
            log.debug("Deleted {} from bucket {}", remoteKey, bucket);
        } catch (SdkException e) {
            throw new StorageProviderException("Failed to delete " + remoteKey + " from bucket " + bucket + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            s3Client.close();
        } catch (Exception e) {
            log.warn("Error closing S3 client: {}", e.getMessage());
        }
    }
}
