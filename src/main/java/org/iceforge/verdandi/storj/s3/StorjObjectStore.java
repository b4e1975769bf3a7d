package org.iceforge.verdandi.storj.s3;

import org.iceforge.verdandi.storj.StorjProperties;
import org.iceforge.verdandi.versioning.VersionHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteMarkerEntry;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.GetBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.GetBucketVersioningResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectVersion;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
public class StorjObjectStore implements ObjectStore {
    private static final Logger logger = LoggerFactory.getLogger(StorjObjectStore.class);

    private static final String VERSIONING_ENABLED = "Enabled";

    private final S3Client s3;
    private final String bucket;

    public StorjObjectStore(S3Client s3, StorjProperties props) {
        this.s3 = Objects.requireNonNull(s3);
        this.bucket = Objects.requireNonNull(props.bucket(), "bucket");
    }

    @Override
    public StorjModels.PutResult put(String key, byte[] body, String contentType) {
        requireKey(key);
        Objects.requireNonNull(body, "body");
        logger.info("Uploading {} bytes to s3://{}/{}", body.length, bucket, key);
        try {
            PutObjectRequest.Builder req = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key);
            if (contentType != null && !contentType.isBlank()) req = req.contentType(contentType);

            PutObjectResponse resp = s3.putObject(req.build(), RequestBody.fromBytes(body));
            logger.info("Uploaded s3://{}/{} versionId={}", bucket, key, resp.versionId());
            return new StorjModels.PutResult(key, resp.eTag(), resp.versionId());
        } catch (SdkException e) {
            logger.error("Failed to upload s3://{}/{}", bucket, key, e);
            throw new StorageBackendException("S3 put failed: s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public byte[] get(String key) {
        return fetch(key, null).body();
    }

    @Override
    public byte[] getVersion(String key, String versionId) {
        requireVersionId(versionId);
        return fetch(key, versionId).body();
    }

    @Override
    public StorjModels.StoredObject getWithMetadata(String key) {
        return fetch(key, null);
    }

    @Override
    public StorjModels.StoredObject getVersionWithMetadata(String key, String versionId) {
        requireVersionId(versionId);
        return fetch(key, versionId);
    }

    private StorjModels.StoredObject fetch(String key, String versionId) {
        requireKey(key);
        String version = versionId == null ? "<current>" : versionId;
        logger.info("Downloading s3://{}/{} versionId={}", bucket, key, version);

        GetObjectRequest.Builder req = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key);
        if (versionId != null) req = req.versionId(versionId);

        try (ResponseInputStream<GetObjectResponse> ris = s3.getObject(req.build())) {
            byte[] body = ris.readAllBytes();
            GetObjectResponse r = ris.response();
            logger.info("Downloaded {} bytes from s3://{}/{} versionId={}", body.length, bucket, key, version);
            return new StorjModels.StoredObject(
                    body,
                    r.contentType(),
                    r.metadata() == null ? Map.of() : Map.copyOf(r.metadata())
            );
        } catch (SdkException | IOException e) {
            logger.error("Failed to download s3://{}/{} versionId={}", bucket, key, version, e);
            throw new StorageBackendException("S3 get failed: s3://" + bucket + "/" + key + " versionId=" + version, e);
        }
    }

    @Override
    public List<StorjModels.ObjectSummary> listCurrent() {
        logger.info("Listing objects in bucket {}", bucket);
        try {
            List<StorjModels.ObjectSummary> out = new ArrayList<>();
            String token = null;
            do {
                ListObjectsV2Request.Builder req = ListObjectsV2Request.builder().bucket(bucket);
                if (token != null) req = req.continuationToken(token);

                ListObjectsV2Response r = s3.listObjectsV2(req.build());
                if (r.contents() != null) {
                    for (S3Object o : r.contents()) {
                        out.add(new StorjModels.ObjectSummary(
                                o.key(), o.size() == null ? 0L : o.size(), o.eTag(), o.lastModified()));
                    }
                }
                token = Boolean.TRUE.equals(r.isTruncated()) ? r.nextContinuationToken() : null;
            } while (token != null);

            logger.info("Found {} objects in bucket {}", out.size(), bucket);
            return out;
        } catch (SdkException e) {
            logger.error("Failed to list objects in bucket {}", bucket, e);
            throw new StorageBackendException("S3 list failed: bucket=" + bucket, e);
        }
    }

    @Override
    public List<StorjModels.VersionEntry> listAllVersions() {
        logger.info("Listing all object versions in bucket {}", bucket);
        try {
            List<StorjModels.VersionEntry> versions = listVersions(null).versions();
            logger.info("Found {} object versions in bucket {}", versions.size(), bucket);
            return versions;
        } catch (SdkException e) {
            logger.error("Failed to list object versions in bucket {}", bucket, e);
            throw new StorageBackendException("S3 list versions failed: bucket=" + bucket, e);
        }
    }

    @Override
    public List<StorjModels.VersionEntry> listVersionsForKey(String key) {
        requireKey(key);
        logger.info("Listing versions for s3://{}/{}", bucket, key);
        try {
            VersionListing listing = listVersions(key);
            List<StorjModels.VersionEntry> history = VersionHistory.merge(listing.versions(), listing.deleteMarkers());
            logger.info("Found {} versions/markers for s3://{}/{}", history.size(), bucket, key);
            return history;
        } catch (SdkException e) {
            logger.error("Failed to list versions for s3://{}/{}", bucket, key, e);
            throw new StorageBackendException("S3 list versions failed: s3://" + bucket + "/" + key, e);
        }
    }

    /** Follows key/version-id markers until the listing is no longer truncated. */
    private VersionListing listVersions(String prefix) {
        List<StorjModels.VersionEntry> versions = new ArrayList<>();
        List<StorjModels.VersionEntry> markers = new ArrayList<>();

        String keyMarker = null;
        String versionIdMarker = null;
        boolean truncated;
        do {
            ListObjectVersionsRequest.Builder req = ListObjectVersionsRequest.builder().bucket(bucket);
            if (prefix != null) req = req.prefix(prefix);
            if (keyMarker != null) req = req.keyMarker(keyMarker).versionIdMarker(versionIdMarker);

            ListObjectVersionsResponse r = s3.listObjectVersions(req.build());
            if (r.versions() != null) {
                for (ObjectVersion v : r.versions()) {
                    versions.add(StorjModels.VersionEntry.ofVersion(
                            v.key(), v.versionId(), Boolean.TRUE.equals(v.isLatest()),
                            v.lastModified(), v.size(), v.eTag()));
                }
            }
            if (r.deleteMarkers() != null) {
                for (DeleteMarkerEntry m : r.deleteMarkers()) {
                    markers.add(StorjModels.VersionEntry.ofDeleteMarker(
                            m.key(), m.versionId(), Boolean.TRUE.equals(m.isLatest()), m.lastModified()));
                }
            }

            truncated = Boolean.TRUE.equals(r.isTruncated()) && r.nextKeyMarker() != null;
            keyMarker = r.nextKeyMarker();
            versionIdMarker = r.nextVersionIdMarker();
        } while (truncated);

        return new VersionListing(versions, markers);
    }

    @Override
    public StorjModels.DeleteResult deleteVersion(String key, String versionId) {
        requireKey(key);
        requireVersionId(versionId);
        logger.info("Deleting s3://{}/{} versionId={}", bucket, key, versionId);
        try {
            DeleteObjectResponse r = s3.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .versionId(versionId)
                    .build());
            logger.info("Deleted s3://{}/{} versionId={}", bucket, key, versionId);
            return new StorjModels.DeleteResult(
                    key,
                    r.versionId() == null ? versionId : r.versionId(),
                    Boolean.TRUE.equals(r.deleteMarker()));
        } catch (SdkException e) {
            logger.error("Failed to delete s3://{}/{} versionId={}", bucket, key, versionId, e);
            throw new StorageBackendException("S3 delete version failed: s3://" + bucket + "/" + key
                    + " versionId=" + versionId, e);
        }
    }

    @Override
    public String deleteCurrent(String key) {
        requireKey(key);
        logger.info("Placing delete marker on s3://{}/{}", bucket, key);
        try {
            DeleteObjectResponse r = s3.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            logger.info("Placed delete marker on s3://{}/{} markerVersionId={}", bucket, key, r.versionId());
            return r.versionId();
        } catch (SdkException e) {
            logger.error("Failed to place delete marker on s3://{}/{}", bucket, key, e);
            throw new StorageBackendException("S3 delete failed: s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public boolean isVersioningEnabled() {
        logger.info("Checking versioning status of bucket {}", bucket);
        try {
            GetBucketVersioningResponse r = s3.getBucketVersioning(GetBucketVersioningRequest.builder()
                    .bucket(bucket)
                    .build());
            // Suspended and never-enabled buckets both count as disabled
            boolean enabled = VERSIONING_ENABLED.equals(r.statusAsString());
            logger.info("Versioning is {} for bucket {}", enabled ? "enabled" : "disabled", bucket);
            return enabled;
        } catch (SdkException e) {
            logger.error("Failed to read versioning status of bucket {}", bucket, e);
            throw new StorageBackendException("S3 get bucket versioning failed: bucket=" + bucket, e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("key must not be blank");
    }

    private static void requireVersionId(String versionId) {
        if (versionId == null || versionId.isBlank()) throw new IllegalArgumentException("versionId must not be blank");
    }

    private record VersionListing(List<StorjModels.VersionEntry> versions, List<StorjModels.VersionEntry> deleteMarkers) {}
}
