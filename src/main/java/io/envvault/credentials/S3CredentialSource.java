package io.envvault.credentials;

import java.net.URI;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;

/**
 * Downloads AppRole credential files from Amazon S3.
 *
 * <p>Credentials come from the default AWS provider chain (environment, profile,
 * instance or task role). An endpoint override can point the client at
 * LocalStack or another S3-compatible store.
 */
public class S3CredentialSource implements CredentialSource, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(S3CredentialSource.class);

    private final S3Client s3;

    /**
     * Creates a source using an existing client (for testing).
     *
     * @param s3 the S3 client; closed by {@link #close()}
     */
    public S3CredentialSource(S3Client s3) {
        this.s3 = s3;
    }

    /**
     * Builds an S3 client for the given region and optional endpoint.
     *
     * @param region   AWS region, e.g. "eu-west-1"
     * @param endpoint endpoint override, or null for the AWS default
     * @return a new source owning its client
     */
    public static S3CredentialSource create(String region, String endpoint) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create());

        Optional.ofNullable(endpoint)
                .filter(value -> !value.isBlank())
                .map(URI::create)
                .ifPresent(uri -> builder.endpointOverride(uri).forcePathStyle(true));

        return new S3CredentialSource(builder.build());
    }

    @Override
    public byte[] fetch(String bucket, String key) throws CredentialSourceException {
        logger.info("Downloading approle credentials from S3: bucket={}, key={}", bucket, key);

        GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
        try {
            return s3.getObjectAsBytes(request).asByteArray();
        } catch (SdkException e) {
            throw new CredentialSourceException(
                    "cannot download approle credentials file from S3: bucket=" + bucket + ", key=" + key
                            + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        s3.close();
    }
}
