package org.iceforge.verdandi.storj;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Connection settings for the Storj S3-compatible gateway.
 * <p>
 * {@code accessKey}, {@code secretKey}, {@code endpoint} and {@code bucket} are required;
 * see {@link StorjConfigurationException}.
 *
 * @param region          Storj ignores it, but the SDK refuses to build a client without one
 * @param pathStyleAccess Storj only serves path-style requests
 * @param apiCallTimeout  optional; SDK defaults apply when unset
 */
@ConfigurationProperties(prefix = "verdandi.storj")
public record StorjProperties(
        String accessKey,
        String secretKey,
        String endpoint,
        String bucket,
        @DefaultValue("us-east-1") String region,
        @DefaultValue("true") boolean pathStyleAccess,
        Duration apiCallTimeout
) {
    @Override
    public String toString() {
        // keep credentials out of logs and error pages
        return "StorjProperties[endpoint=" + endpoint + ", bucket=" + bucket + ", region=" + region
                + ", pathStyleAccess=" + pathStyleAccess + ", apiCallTimeout=" + apiCallTimeout + "]";
    }
}
