package org.iceforge.verdandi.versioning;

public class NoDeleteMarkerFoundException extends RuntimeException {
    private final String key;

    public NoDeleteMarkerFoundException(String key) {
        super("No delete marker found for key: " + key);
        this.key = key;
    }

    public String key() { return key; }
}
