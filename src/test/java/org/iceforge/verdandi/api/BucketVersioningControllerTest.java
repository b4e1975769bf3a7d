package org.iceforge.verdandi.api;

import org.iceforge.verdandi.storj.s3.StorageBackendException;
import org.iceforge.verdandi.storj.s3.StorjModels;
import org.iceforge.verdandi.versioning.BucketVersioningService;
import org.iceforge.verdandi.versioning.NoDeleteMarkerFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class BucketVersioningControllerTest {

    private BucketVersioningService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = mock(BucketVersioningService.class);

        mockMvc = MockMvcBuilders.standaloneSetup(new BucketVersioningController(service))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    /* ---------- status & listings ---------- */

    @Test
    void status_reports_enabled_flag() throws Exception {
        when(service.isVersioningEnabled()).thenReturn(true);

        mockMvc.perform(get("/bucket-versioning/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    void versions_for_key_keep_service_order() throws Exception {
        when(service.listObjectVersionsForKey("a.txt")).thenReturn(List.of(
                StorjModels.VersionEntry.ofDeleteMarker("a.txt", "dm1", true, Instant.ofEpochSecond(3)),
                StorjModels.VersionEntry.ofVersion("a.txt", "v2", false, Instant.ofEpochSecond(2), 3L, "e2"),
                StorjModels.VersionEntry.ofVersion("a.txt", "v1", false, Instant.ofEpochSecond(1), 3L, "e1")));

        mockMvc.perform(get("/bucket-versioning/versions/a.txt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].versionId").value("dm1"))
                .andExpect(jsonPath("$[0].deleteMarker").value(true))
                .andExpect(jsonPath("$[0].latest").value(true))
                .andExpect(jsonPath("$[2].versionId").value("v1"));
    }

    @Test
    void all_versions_listing() throws Exception {
        when(service.listObjectVersions()).thenReturn(List.of(
                StorjModels.VersionEntry.ofVersion("a.txt", "v1", true, Instant.ofEpochSecond(1), 3L, "e1")));

        mockMvc.perform(get("/bucket-versioning/versions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].key").value("a.txt"))
                .andExpect(jsonPath("$[0].size").value(3));
    }

    @Test
    void current_objects_listing() throws Exception {
        when(service.listObjects()).thenReturn(List.of(
                new StorjModels.ObjectSummary("b.txt", 5L, "e", Instant.ofEpochSecond(1))));

        mockMvc.perform(get("/bucket-versioning/objects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].key").value("b.txt"));
    }

    /* ---------- downloads ---------- */

    @Test
    void download_version_is_an_attachment() throws Exception {
        byte[] data = "old".getBytes(StandardCharsets.UTF_8);
        when(service.getObjectVersion("a.txt", "v1")).thenReturn(data);

        mockMvc.perform(get("/bucket-versioning/versions/a.txt/v1/download"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"a.txt\""))
                .andExpect(content().bytes(data));
    }

    @Test
    void version_metadata_is_reflected_as_headers() throws Exception {
        byte[] data = "old".getBytes(StandardCharsets.UTF_8);
        when(service.getObjectVersionWithMetadata("a.txt", "v1"))
                .thenReturn(new StorjModels.StoredObject(data, "text/plain", Map.of("owner", "alice")));

        mockMvc.perform(get("/bucket-versioning/versions/a.txt/v1/metadata"))
                .andExpect(status().isOk())
                .andExpect(header().string("owner", "alice"))
                .andExpect(content().bytes(data));
    }

    @Test
    void current_version_carries_metadata() throws Exception {
        byte[] data = "now".getBytes(StandardCharsets.UTF_8);
        when(service.getCurrentObjectVersion("a.txt"))
                .thenReturn(new StorjModels.StoredObject(data, null, Map.of("origin", "scanner")));

        mockMvc.perform(get("/bucket-versioning/current/a.txt"))
                .andExpect(status().isOk())
                .andExpect(header().string("origin", "scanner"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"a.txt\""))
                .andExpect(content().bytes(data));
    }

    @Test
    void download_latest() throws Exception {
        byte[] data = "now".getBytes(StandardCharsets.UTF_8);
        when(service.downloadFile("a.txt")).thenReturn(data);

        mockMvc.perform(get("/bucket-versioning/download/a.txt"))
                .andExpect(status().isOk())
                .andExpect(content().bytes(data));
    }

    /* ---------- mutations ---------- */

    @Test
    void delete_version_returns_result() throws Exception {
        when(service.deleteObjectVersion("a.txt", "v1"))
                .thenReturn(new StorjModels.DeleteResult("a.txt", "v1", false));

        mockMvc.perform(delete("/bucket-versioning/versions/a.txt/v1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.versionId").value("v1"))
                .andExpect(jsonPath("$.deleteMarker").value(false));
    }

    @Test
    void delete_with_marker_returns_marker_version() throws Exception {
        when(service.deleteObjectWithMarker("a.txt")).thenReturn("dm1");

        mockMvc.perform(delete("/bucket-versioning/delete/a.txt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleteVersionId").value("dm1"));
    }

    @Test
    void delete_with_marker_omits_missing_version() throws Exception {
        when(service.deleteObjectWithMarker("a.txt")).thenReturn(null);

        mockMvc.perform(delete("/bucket-versioning/delete/a.txt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleteVersionId").doesNotExist());
    }

    @Test
    void undelete_returns_removed_marker() throws Exception {
        when(service.undelete("a.txt")).thenReturn(new StorjModels.DeleteResult("a.txt", "dm1", true));

        mockMvc.perform(put("/bucket-versioning/undelete/a.txt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.versionId").value("dm1"))
                .andExpect(jsonPath("$.deleteMarker").value(true));
    }

    @Test
    void undelete_without_marker_is_404() throws Exception {
        when(service.undelete("a.txt")).thenThrow(new NoDeleteMarkerFoundException("a.txt"));

        mockMvc.perform(put("/bucket-versioning/undelete/a.txt"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No delete marker found for key: a.txt"));
    }

    @Test
    void upload_forwards_file_bytes_and_content_type() throws Exception {
        byte[] data = "hello".getBytes(StandardCharsets.UTF_8);
        MockMultipartFile file = new MockMultipartFile("file", "hello.txt", "text/plain", data);
        when(service.uploadFile(eq("hello.txt"), any(byte[].class), eq("text/plain")))
                .thenReturn(new StorjModels.PutResult("hello.txt", "etag", "v1"));

        mockMvc.perform(multipart("/bucket-versioning/upload/hello.txt").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.versionId").value("v1"));

        verify(service).uploadFile("hello.txt", data, "text/plain");
    }

    @Test
    void upload_without_file_part_is_400() throws Exception {
        mockMvc.perform(multipart("/bucket-versioning/upload/hello.txt"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(service);
    }

    /* ---------- backend failures ---------- */

    @Test
    void missing_object_maps_to_404() throws Exception {
        when(service.downloadFile("gone.txt")).thenThrow(new StorageBackendException("S3 get failed",
                NoSuchKeyException.builder().statusCode(404).message("missing").build()));

        mockMvc.perform(get("/bucket-versioning/download/gone.txt"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unreachable_backend_maps_to_502() throws Exception {
        when(service.isVersioningEnabled()).thenThrow(new StorageBackendException("S3 get bucket versioning failed",
                SdkClientException.create("connection refused")));

        mockMvc.perform(get("/bucket-versioning/status"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Bad Gateway"));
    }
}
