package org.iceforge.verdandi.storj;

import java.util.List;

public class StorjConfigurationException extends RuntimeException {
    private final List<String> missing;

    public StorjConfigurationException(List<String> missing) {
        super("Storj configuration is incomplete, missing: " + String.join(", ", missing));
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() { return missing; }
}
