package org.iceforge.verdandi.storj.s3;

import org.iceforge.verdandi.storj.StorjConfigurationException;
import org.iceforge.verdandi.storj.StorjProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the single {@link S3Client} shared by every request.
 * Startup fails with {@link StorjConfigurationException} when credentials, endpoint or bucket are missing.
 */
@Configuration
public class StorjClientConfig {
    private static final Logger log = LoggerFactory.getLogger(StorjClientConfig.class);

    @Bean(destroyMethod = "close")
    public S3Client s3Client(StorjProperties props) {
        validate(props);

        log.info("Initializing Storj S3 client endpoint={} region={} bucket={} pathStyleAccess={}",
                props.endpoint(), props.region(), props.bucket(), props.pathStyleAccess());

        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(props.accessKey(), props.secretKey())))
                .region(Region.of(props.region()))
                .endpointOverride(URI.create(props.endpoint()))
                .serviceConfiguration(
                        S3Configuration.builder()
                                .pathStyleAccessEnabled(props.pathStyleAccess())
                                .build()
                );

        if (props.apiCallTimeout() != null) {
            b = b.overrideConfiguration(ClientOverrideConfiguration.builder()
                    .apiCallTimeout(props.apiCallTimeout())
                    .build());
        }

        return b.build();
    }

    static void validate(StorjProperties props) {
        List<String> missing = new ArrayList<>();
        if (isBlank(props.accessKey())) missing.add("verdandi.storj.access-key");
        if (isBlank(props.secretKey())) missing.add("verdandi.storj.secret-key");
        if (isBlank(props.endpoint())) missing.add("verdandi.storj.endpoint");
        if (isBlank(props.bucket())) missing.add("verdandi.storj.bucket");

        if (!missing.isEmpty()) {
            log.error("Storj configuration is incomplete, missing {}", missing);
            throw new StorjConfigurationException(missing);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
