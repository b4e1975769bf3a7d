package org.iceforge.verdandi.api;

import org.iceforge.verdandi.storj.s3.StorjModels;
import org.iceforge.verdandi.versioning.BucketVersioningService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/bucket-versioning")
public class BucketVersioningController {

    private final BucketVersioningService service;

    public BucketVersioningController(BucketVersioningService service) {
        this.service = Objects.requireNonNull(service);
    }

    @GetMapping("/status")
    public BucketVersioningModels.VersioningStatusResponse status() {
        return new BucketVersioningModels.VersioningStatusResponse(service.isVersioningEnabled());
    }

    @GetMapping("/objects")
    public List<StorjModels.ObjectSummary> listObjects() {
        return service.listObjects();
    }

    @GetMapping("/versions")
    public List<StorjModels.VersionEntry> listObjectVersions() {
        return service.listObjectVersions();
    }

    /** Versions and delete markers of one key, newest first. */
    @GetMapping("/versions/{key}")
    public List<StorjModels.VersionEntry> listObjectVersionsForKey(@PathVariable String key) {
        return service.listObjectVersionsForKey(key);
    }

    @GetMapping("/versions/{key}/{versionId}/download")
    public ResponseEntity<byte[]> downloadObjectVersion(@PathVariable String key, @PathVariable String versionId) {
        return attachment(key, service.getObjectVersion(key, versionId), Map.of());
    }

    @GetMapping("/versions/{key}/{versionId}/metadata")
    public ResponseEntity<byte[]> getObjectVersionWithMetadata(@PathVariable String key, @PathVariable String versionId) {
        StorjModels.StoredObject obj = service.getObjectVersionWithMetadata(key, versionId);
        return attachment(key, obj.body(), obj.metadata());
    }

    @DeleteMapping("/versions/{key}/{versionId}")
    public StorjModels.DeleteResult deleteObjectVersion(@PathVariable String key, @PathVariable String versionId) {
        return service.deleteObjectVersion(key, versionId);
    }

    @GetMapping("/current/{key}")
    public ResponseEntity<byte[]> getCurrentObjectVersion(@PathVariable String key) {
        StorjModels.StoredObject obj = service.getCurrentObjectVersion(key);
        return attachment(key, obj.body(), obj.metadata());
    }

    @GetMapping("/download/{key}")
    public ResponseEntity<byte[]> downloadLatestObject(@PathVariable String key) {
        return attachment(key, service.downloadFile(key), Map.of());
    }

    @DeleteMapping("/delete/{key}")
    public BucketVersioningModels.DeleteMarkerResponse deleteObjectWithMarker(@PathVariable String key) {
        return new BucketVersioningModels.DeleteMarkerResponse(service.deleteObjectWithMarker(key));
    }

    @PutMapping("/undelete/{key}")
    public StorjModels.DeleteResult undeleteObject(@PathVariable String key) {
        return service.undelete(key);
    }

    @PostMapping(path = "/upload/{key}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public StorjModels.PutResult uploadFile(@PathVariable String key,
                                            @RequestPart("file") MultipartFile file) throws IOException {
        return service.uploadFile(key, file.getBytes(), file.getContentType());
    }

    /** User metadata is reflected verbatim as response headers. */
    private static ResponseEntity<byte[]> attachment(String key, byte[] body, Map<String, String> metadata) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.setContentDisposition(ContentDisposition.attachment().filename(key).build());
        metadata.forEach(headers::add);
        return ResponseEntity.ok()
                .headers(headers)
                .contentLength(body.length)
                .body(body);
    }
}
