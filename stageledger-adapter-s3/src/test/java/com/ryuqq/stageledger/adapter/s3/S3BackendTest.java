package com.ryuqq.stageledger.adapter.s3;

import com.ryuqq.stageledger.core.exception.BackendUnavailableException;
import com.ryuqq.stageledger.core.exception.DocumentNotFoundException;
import com.ryuqq.stageledger.core.model.StateLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * S3Backend 유닛 테스트.
 *
 * <p>S3 오류가 NotFound / BackendUnavailable로 올바르게 구분되는지 검증합니다:</p>
 * <ul>
 *   <li>NoSuchKey, 404 → 문서 없음</li>
 *   <li>403, NoSuchBucket, 네트워크 오류 → BackendUnavailable</li>
 * </ul>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class S3BackendTest {

    private static final StateLocation LOCATION = StateLocation.inBucket("ca-state-bucket", "path/to/state.json");

    @Mock
    private S3Client s3Client;

    private S3Backend backend;

    @BeforeEach
    void setUp() {
        backend = new S3Backend(s3Client);
    }

    // ============================================================
    // 1. 문서 없음
    // ============================================================

    @Test
    void exists_404_응답이면_false() {
        // given
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(s3Error(404, "NoSuchKey"));

        // when & then
        assertThat(backend.exists(LOCATION)).isFalse();
    }

    @Test
    void read_404_응답이면_DocumentNotFound() {
        // given
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(s3Error(404, "NoSuchKey"));

        // when & then
        DocumentNotFoundException exception =
                catchThrowableOfType(() -> backend.read(LOCATION), DocumentNotFoundException.class);
        assertThat(exception).isNotNull();
        assertThat(exception.location()).isEqualTo(LOCATION);
    }

    // ============================================================
    // 2. 연결/권한 오류는 "없음"으로 취급하지 않음
    // ============================================================

    @Test
    void exists_권한_오류는_BackendUnavailable() {
        // given
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(s3Error(403, "AccessDenied"));

        // when & then
        assertThatThrownBy(() -> backend.exists(LOCATION))
                .isInstanceOf(BackendUnavailableException.class)
                .hasCauseInstanceOf(S3Exception.class);
    }

    @Test
    void exists_버킷이_없으면_BackendUnavailable() {
        // given
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(s3Error(404, "NoSuchBucket"));

        // when & then
        assertThatThrownBy(() -> backend.exists(LOCATION))
                .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void read_네트워크_오류는_BackendUnavailable() {
        // given
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        // when & then
        assertThatThrownBy(() -> backend.read(LOCATION))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("s3://ca-state-bucket/path/to/state.json");
    }

    @Test
    void write_실패는_BackendUnavailable() {
        // given
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(s3Error(403, "AccessDenied"));

        // when & then
        assertThatThrownBy(() -> backend.write(LOCATION, "{}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(BackendUnavailableException.class);
    }

    // ============================================================
    // 3. 요청 형태
    // ============================================================

    @Test
    void write_버킷_키_본문을_담아_PutObject() throws IOException {
        // given
        byte[] content = "{\"version\":\"v1\",\"stages\":{}}".getBytes(StandardCharsets.UTF_8);

        // when
        backend.write(LOCATION, content);

        // then
        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> body = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client).putObject(request.capture(), body.capture());

        assertThat(request.getValue().bucket()).isEqualTo("ca-state-bucket");
        assertThat(request.getValue().key()).isEqualTo("path/to/state.json");
        assertThat(request.getValue().contentType()).isEqualTo("application/json");
        try (InputStream in = body.getValue().contentStreamProvider().newStream()) {
            assertThat(in.readAllBytes()).isEqualTo(content);
        }
    }

    @Test
    void 경로_위치는_거부됨() {
        // given
        StateLocation path = StateLocation.ofPath("state.json");

        // when & then
        assertThatThrownBy(() -> backend.read(path)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backend.write(path, new byte[0])).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(s3Client);
    }

    @Test
    void constructor_null_client는_거부됨() {
        assertThatThrownBy(() -> new S3Backend(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private static S3Exception s3Error(int statusCode, String errorCode) {
        return (S3Exception) S3Exception.builder()
                .statusCode(statusCode)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(errorCode).build())
                .message(errorCode)
                .build();
    }
}
