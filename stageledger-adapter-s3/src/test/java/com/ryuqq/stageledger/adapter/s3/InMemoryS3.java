package com.ryuqq.stageledger.adapter.s3;

import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked {@link S3Client} answering GetObject and PutObject from a map.
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
final class InMemoryS3 {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final S3Client client = mock(S3Client.class);

    InMemoryS3() {
        when(client.getObjectAsBytes(any(GetObjectRequest.class))).thenAnswer(invocation -> {
            GetObjectRequest request = invocation.getArgument(0);
            byte[] body = objects.get(objectId(request.bucket(), request.key()));
            if (body == null) {
                throw NoSuchKeyException.builder()
                        .statusCode(404)
                        .message("The specified key does not exist.")
                        .build();
            }
            return ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), body);
        });
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenAnswer(invocation -> {
            PutObjectRequest request = invocation.getArgument(0);
            RequestBody body = invocation.getArgument(1);
            try (InputStream in = body.contentStreamProvider().newStream()) {
                objects.put(objectId(request.bucket(), request.key()), in.readAllBytes());
            }
            return PutObjectResponse.builder().build();
        });
    }

    S3Client client() {
        return client;
    }

    private static String objectId(String bucket, String key) {
        return bucket + "/" + key;
    }
}
