/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.slotlander.config.Configuration;

import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

@ExtendWith(MockitoExtension.class)
public class S3ObjectSinkTest {

    @Mock
    private S3Client client;

    @Test
    public void shouldPutObjectInSingleRequest() {
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenReturn(PutObjectResponse.builder().build());
        byte[] content = "capture_ts,log_position,op,columns\n".getBytes(StandardCharsets.UTF_8);

        new S3ObjectSink(client).putObject("raw", "inc/data=20250131/x.csv", content, "text/csv");

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(client).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().bucket()).isEqualTo("raw");
        assertThat(request.getValue().key()).isEqualTo("inc/data=20250131/x.csv");
        assertThat(request.getValue().contentType()).isEqualTo("text/csv");
        assertThat(request.getValue().contentLength()).isEqualTo(content.length);
    }

    @Test
    public void shouldRaiseSinkWriteExceptionOnClientFailure() {
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request: minio"));

        assertThatThrownBy(() -> new S3ObjectSink(client).putObject("raw", "k.csv", new byte[0], "text/csv"))
                .isInstanceOfSatisfying(SinkWriteException.class, e -> {
                    assertThat(e.getBucket()).isEqualTo("raw");
                    assertThat(e.getKey()).isEqualTo("k.csv");
                })
                .hasCauseInstanceOf(SdkClientException.class);
    }

    @Test
    public void shouldRaiseSinkWriteExceptionWhenClientFailsOutsideSdk() {
        RuntimeException failure = new RuntimeException(new URISyntaxException("minio:", "Expected scheme-specific part", 6));
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenThrow(failure);

        assertThatThrownBy(() -> new S3ObjectSink(client).putObject("raw", "k.csv", new byte[0], "text/csv"))
                .isInstanceOfSatisfying(SinkWriteException.class, e -> {
                    assertThat(e.getBucket()).isEqualTo("raw");
                    assertThat(e.getKey()).isEqualTo("k.csv");
                })
                .hasCause(failure);
    }

    @Test
    public void shouldCloseClient() {
        new S3ObjectSink(client).close();

        verify(client).close();
    }

    @Test
    public void shouldBuildClientForCompatibleEndpoint() {
        Configuration config = Configuration.create()
                .with(S3ObjectSink.ENDPOINT, "http://minio:9000")
                .with(S3ObjectSink.ACCESS_KEY, "minioadmin")
                .with(S3ObjectSink.SECRET_KEY, "minioadmin")
                .build();

        try (S3Client built = S3ObjectSink.createClient(config)) {
            assertThat(built.serviceClientConfiguration().endpointOverride()).hasValueSatisfying(
                    uri -> assertThat(uri.toString()).isEqualTo("http://minio:9000"));
            assertThat(built.serviceClientConfiguration().region().id()).isEqualTo("us-east-1");
        }
    }
}
