package org.iceforge.verdandi.storj.s3;

import java.time.Instant;
import java.util.Map;

public final class StorjModels {

    private StorjModels() {}

    public record ObjectSummary(
            String key,
            long size,
            String eTag,
            Instant lastModified
    ) {}

    /**
     * One slot in a key's history: either a stored version or a delete marker.
     * {@code size} and {@code eTag} are null for delete markers.
     */
    public record VersionEntry(
            String key,
            String versionId,
            boolean latest,
            boolean deleteMarker,
            Instant lastModified,
            Long size,
            String eTag
    ) {
        public static VersionEntry ofVersion(String key, String versionId, boolean latest,
                                             Instant lastModified, Long size, String eTag) {
            return new VersionEntry(key, versionId, latest, false, lastModified, size, eTag);
        }

        public static VersionEntry ofDeleteMarker(String key, String versionId, boolean latest, Instant lastModified) {
            return new VersionEntry(key, versionId, latest, true, lastModified, null, null);
        }
    }

    public record StoredObject(
            byte[] body,
            String contentType,
            Map<String, String> metadata
    ) {}

    public record PutResult(
            String key,
            String eTag,
            String versionId
    ) {}

    public record DeleteResult(
            String key,
            String versionId,
            boolean deleteMarker
    ) {}
}
