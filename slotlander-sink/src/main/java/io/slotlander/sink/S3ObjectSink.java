/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

import java.net.URI;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.slotlander.config.Configuration;
import io.slotlander.config.Field;
import io.slotlander.util.Strings;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Stores objects in Amazon S3 or an S3 compatible store such as MinIO. Each object is written with a single
 * {@code PutObject} request, so it is either stored in full or not at all.
 */
public class S3ObjectSink implements ObjectSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectSink.class);

    public static final Field ENDPOINT = Field.create("endpoint")
            .withDescription("URL of the S3 compatible endpoint, e.g. http://minio:9000; if blank the AWS endpoint of the region is used.");
    public static final Field REGION = Field.create("region")
            .withDescription("Region the client signs requests for.")
            .withDefault("us-east-1");
    public static final Field ACCESS_KEY = Field.create("access.key")
            .withDescription("Access key id.");
    public static final Field SECRET_KEY = Field.create("secret.key")
            .withDescription("Secret access key.");
    public static final Field API_CALL_TIMEOUT_MS = Field.create("api.call.timeout.ms")
            .withDescription("Maximum time in milliseconds for a complete request, including retries.")
            .withDefault(30_000);

    public static final Field.Set ALL_FIELDS = Field.setOf(ENDPOINT, REGION, ACCESS_KEY, SECRET_KEY, API_CALL_TIMEOUT_MS);

    private final S3Client client;

    /**
     * Create a sink whose client is configured from the fields in {@link #ALL_FIELDS}. Without an endpoint the client
     * talks to AWS, with one it uses path-style addressing as MinIO requires.
     *
     * @param config the configuration; may not be null
     */
    public S3ObjectSink(Configuration config) {
        this(createClient(config));
    }

    public S3ObjectSink(S3Client client) {
        this.client = client;
    }

    static S3Client createClient(Configuration config) {
        final S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(config.getString(REGION)))
                .overrideConfiguration(c -> c.apiCallTimeout(Duration.ofMillis(config.getLong(API_CALL_TIMEOUT_MS))));

        final String endpoint = config.getString(ENDPOINT);
        if (!Strings.isNullOrBlank(endpoint)) {
            LOGGER.info("Using S3 compatible endpoint {}", endpoint);
            builder.endpointOverride(URI.create(endpoint.trim()))
                    .forcePathStyle(true);
        }
        final String accessKey = config.getString(ACCESS_KEY);
        if (!Strings.isNullOrBlank(accessKey)) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(accessKey, Strings.defaultIfBlank(config.getString(SECRET_KEY), ""))));
        }
        return builder.build();
    }

    @Override
    public void putObject(String bucket, String key, byte[] content, String contentType) {
        final PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) content.length)
                .build();
        try {
            client.putObject(request, RequestBody.fromBytes(content));
        }
        catch (SdkException e) {
            throw new SinkWriteException(bucket, key, "Failed to write object '" + key + "' to bucket '" + bucket + "': " + e.getMessage(), e);
        }
        catch (RuntimeException e) {
            // the client also fails outside SdkException, e.g. when it cannot resolve the endpoint
            throw new SinkWriteException(bucket, key, "Unexpected failure writing object '" + key + "' to bucket '" + bucket + "': " + e, e);
        }
        LOGGER.debug("Stored {} bytes as {}/{}", content.length, bucket, key);
    }

    @Override
    public void close() {
        client.close();
    }
}
