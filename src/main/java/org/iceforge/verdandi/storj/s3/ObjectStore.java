package org.iceforge.verdandi.storj.s3;

import java.util.List;

/**
 * Single-bucket access to a versioned S3-compatible store.
 * Every call is one attempt; backend failures surface as {@link StorageBackendException}.
 */
public interface ObjectStore {

    // Upload
    default StorjModels.PutResult put(String key, byte[] body) {
        return put(key, body, null);
    }
    StorjModels.PutResult put(String key, byte[] body, String contentType);

    // Download
    byte[] get(String key);
    byte[] getVersion(String key, String versionId);
    StorjModels.StoredObject getWithMetadata(String key);
    StorjModels.StoredObject getVersionWithMetadata(String key, String versionId);

    // List
    List<StorjModels.ObjectSummary> listCurrent();
    List<StorjModels.VersionEntry> listAllVersions();

    /** Versions and delete markers under {@code key} as a prefix, newest first. */
    List<StorjModels.VersionEntry> listVersionsForKey(String key);

    // Delete
    StorjModels.DeleteResult deleteVersion(String key, String versionId);

    /** Adds a delete marker and returns its version id, or null if the store reported none. */
    String deleteCurrent(String key);

    boolean isVersioningEnabled();
}
