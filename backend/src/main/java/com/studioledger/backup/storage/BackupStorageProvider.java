package com.studioledger.backup.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Uniform contract over the cloud storage services backups are shipped to.
 * Instances hold SDK clients and must be closed after use.
 */
public interface BackupStorageProvider extends AutoCloseable {

    /**
     * Checks credentials and reachability of the configured bucket or folder.
     * Never throws; failures are reported in the result.
     */
    ConnectionTestResult testConnection();

    /**
     * Lists the backup archives held by this destination, in no particular order.
     */
    List<StorageObject> list();

    /**
     * Uploads a local file, replacing any object already stored under the key.
     */
    void upload(Path localPath, String remoteKey);

    /**
     * Downloads a whole object to the given local path.
     */
    void download(String remoteKey, Path localPath);

    void delete(String remoteKey);

    @Override
    void close();
}
