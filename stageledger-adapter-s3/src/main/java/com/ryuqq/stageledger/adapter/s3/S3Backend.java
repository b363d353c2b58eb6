package com.ryuqq.stageledger.adapter.s3;

import com.ryuqq.stageledger.core.exception.BackendUnavailableException;
import com.ryuqq.stageledger.core.exception.DocumentNotFoundException;
import com.ryuqq.stageledger.core.model.StateLocation;
import com.ryuqq.stageledger.core.spi.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Amazon S3 implementation of {@link Backend}.
 *
 * <p>The location must carry a bucket; its key is the object key.</p>
 *
 * <p><strong>Error Mapping:</strong></p>
 * <ul>
 *   <li>{@link NoSuchKeyException} or HTTP 404 → {@link DocumentNotFoundException}</li>
 *   <li>any other {@link SdkException} (network, 403, missing bucket, throttling) → {@link BackendUnavailableException}</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> PutObject replaces the object atomically; readers see either
 * the old or the new document. There is no conditional write, so concurrent writers race.</p>
 *
 * <p>Timeouts and retries of individual HTTP requests are governed by the {@link S3Client}
 * configuration supplied by the caller.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public class S3Backend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(S3Backend.class);

    static final String CONTENT_TYPE = "application/json";
    private static final int HTTP_NOT_FOUND = 404;

    private final S3Client s3Client;

    /**
     * 생성자.
     *
     * @param s3Client S3 클라이언트
     * @throws IllegalArgumentException s3Client가 null인 경우
     */
    public S3Backend(S3Client s3Client) {
        if (s3Client == null) {
            throw new IllegalArgumentException("s3Client cannot be null");
        }
        this.s3Client = s3Client;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Issues a GetObject request; only a "no such key" answer is reported as {@code false}.</p>
     */
    @Override
    public boolean exists(StateLocation location) {
        try {
            fetch(location);
            return true;
        } catch (DocumentNotFoundException e) {
            return false;
        }
    }

    @Override
    public byte[] read(StateLocation location) {
        byte[] content = fetch(location).asByteArray();
        log.debug("Read {} bytes from {}", content.length, location);
        return content;
    }

    @Override
    public void write(StateLocation location, byte[] content) {
        String bucket = bucketOf(location);
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(location.key())
                .contentType(CONTENT_TYPE)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.debug("Wrote {} bytes to {}", content.length, location);
        } catch (SdkException e) {
            throw new BackendUnavailableException("Failed to write state object " + location, location, e);
        }
    }

    private ResponseBytes<GetObjectResponse> fetch(StateLocation location) {
        String bucket = bucketOf(location);
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(location.key())
                .build();
        try {
            return s3Client.getObjectAsBytes(request);
        } catch (NoSuchKeyException e) {
            throw new DocumentNotFoundException(location, e);
        } catch (S3Exception e) {
            if (e.statusCode() == HTTP_NOT_FOUND && !isMissingBucket(e)) {
                throw new DocumentNotFoundException(location, e);
            }
            throw new BackendUnavailableException("Failed to read state object " + location, location, e);
        } catch (SdkException e) {
            throw new BackendUnavailableException("Failed to read state object " + location, location, e);
        }
    }

    private static boolean isMissingBucket(S3Exception e) {
        return e.awsErrorDetails() != null && "NoSuchBucket".equals(e.awsErrorDetails().errorCode());
    }

    private static String bucketOf(StateLocation location) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        return location.bucket().orElseThrow(() ->
                new IllegalArgumentException("S3 backend requires a bucket location: " + location));
    }
}
