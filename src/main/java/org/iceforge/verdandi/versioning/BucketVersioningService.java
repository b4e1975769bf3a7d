package org.iceforge.verdandi.versioning;

import org.iceforge.verdandi.storj.s3.ObjectStore;
import org.iceforge.verdandi.storj.s3.StorjModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Version management on top of {@link ObjectStore}.
 * Everything except {@link #undelete(String)} is a straight delegation.
 */
@Service
public class BucketVersioningService {
    private static final Logger log = LoggerFactory.getLogger(BucketVersioningService.class);

    private final ObjectStore store;

    public BucketVersioningService(ObjectStore store) {
        this.store = Objects.requireNonNull(store);
    }

    public boolean isVersioningEnabled() {
        return store.isVersioningEnabled();
    }

    public List<StorjModels.ObjectSummary> listObjects() {
        return store.listCurrent();
    }

    public List<StorjModels.VersionEntry> listObjectVersions() {
        return store.listAllVersions();
    }

    public List<StorjModels.VersionEntry> listObjectVersionsForKey(String key) {
        return store.listVersionsForKey(key);
    }

    public byte[] getObjectVersion(String key, String versionId) {
        return store.getVersion(key, versionId);
    }

    public StorjModels.StoredObject getCurrentObjectVersion(String key) {
        return store.getWithMetadata(key);
    }

    public StorjModels.StoredObject getObjectVersionWithMetadata(String key, String versionId) {
        return store.getVersionWithMetadata(key, versionId);
    }

    public byte[] downloadFile(String key) {
        return store.get(key);
    }

    public StorjModels.PutResult uploadFile(String key, byte[] body, String contentType) {
        return store.put(key, body, contentType);
    }

    public StorjModels.DeleteResult deleteObjectVersion(String key, String versionId) {
        return store.deleteVersion(key, versionId);
    }

    public String deleteObjectWithMarker(String key) {
        return store.deleteCurrent(key);
    }

    /**
     * Restores the previously current version of {@code key} by removing its newest delete marker.
     *
     * @throws NoDeleteMarkerFoundException if the key has no delete marker; nothing is deleted
     */
    public StorjModels.DeleteResult undelete(String key) {
        log.info("Undeleting object for key: {}", key);

        List<StorjModels.VersionEntry> history = store.listVersionsForKey(key);
        StorjModels.VersionEntry marker = VersionHistory.latestDeleteMarker(key, history)
                .orElseThrow(() -> {
                    log.warn("No delete marker found for key: {}", key);
                    return new NoDeleteMarkerFoundException(key);
                });

        log.info("Removing delete marker versionId={} for key: {}", marker.versionId(), key);
        StorjModels.DeleteResult result = store.deleteVersion(key, marker.versionId());
        log.info("Undeleted object for key: {}", key);
        return result;
    }
}
