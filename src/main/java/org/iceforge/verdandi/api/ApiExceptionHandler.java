package org.iceforge.verdandi.api;

import org.iceforge.verdandi.storj.s3.StorageBackendException;
import org.iceforge.verdandi.versioning.NoDeleteMarkerFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to HTTP statuses. Logging already happened where the failure occurred.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NoDeleteMarkerFoundException.class)
    public ResponseEntity<BucketVersioningModels.ApiError> noDeleteMarker(NoDeleteMarkerFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    /** Client errors reported by the store (404 NoSuchKey, 403 AccessDenied, ...) pass through; the rest is 502. */
    @ExceptionHandler(StorageBackendException.class)
    public ResponseEntity<BucketVersioningModels.ApiError> backend(StorageBackendException e) {
        HttpStatus status = e.backendStatus()
                .map(HttpStatus::resolve)
                .filter(HttpStatus::is4xxClientError)
                .orElse(HttpStatus.BAD_GATEWAY);
        return error(status, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<BucketVersioningModels.ApiError> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    private static ResponseEntity<BucketVersioningModels.ApiError> error(HttpStatus status, Exception e) {
        return ResponseEntity.status(status)
                .body(new BucketVersioningModels.ApiError(status.getReasonPhrase(), e.getMessage()));
    }
}
