package org.iceforge.verdandi.storj.s3;

import software.amazon.awssdk.core.exception.SdkServiceException;

import java.util.Optional;

public class StorageBackendException extends RuntimeException {
    public StorageBackendException(String message, Throwable cause) { super(message, cause); }

    /** HTTP status reported by the store, if the failure came back as a service error. */
    public Optional<Integer> backendStatus() {
        if (getCause() instanceof SdkServiceException sse && sse.statusCode() > 0) {
            return Optional.of(sse.statusCode());
        }
        return Optional.empty();
    }
}
