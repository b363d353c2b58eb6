package com.ryuqq.stageledger.testkit.contract;

import com.ryuqq.stageledger.core.exception.MalformedDocumentException;
import com.ryuqq.stageledger.core.model.StageName;
import com.ryuqq.stageledger.core.model.StageResult;
import com.ryuqq.stageledger.core.model.StageState;
import com.ryuqq.stageledger.core.model.StageStatus;
import com.ryuqq.stageledger.core.model.StateLocation;
import com.ryuqq.stageledger.core.store.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contract Tests for {@link StateStore} running on a concrete Backend.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Idempotent initialization: second call performs no write</li>
 *   <li>Initialization never overwrites an existing document</li>
 *   <li>Sticky completion: COMPLETED is never reopened</li>
 *   <li>No-op on equal state: no write, other stages untouched</li>
 *   <li>Isolation across stages</li>
 *   <li>Corrupt documents are surfaced, never replaced</li>
 *   <li>Read-only and check-mode calls never write</li>
 * </ul>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public abstract class AbstractStateStoreContractTest extends AbstractBackendContractTest {

    protected static final String EMPTY_DOCUMENT = "{\"version\":\"v1\",\"stages\":{}}";

    protected StateStore store;
    protected StateLocation location;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Runs after {@code setUpBackend()} of the superclass.</p>
     */
    @BeforeEach
    void setUpStore() {
        store = new StateStore(backend);
        location = newLocation("state.json");
    }

    @Test
    void ensureInitialized_Twice_WritesOnce() {
        // When
        boolean first = store.ensureInitialized(location);
        boolean second = store.ensureInitialized(location);

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(backend.writeCount()).isEqualTo(1);
        assertThat(utf8(backend.read(location))).isEqualTo(EMPTY_DOCUMENT);
    }

    @Test
    void ensureInitialized_ExistingDocument_IsNotOverwritten() {
        // Given
        String existing = "{\"version\":\"v1\",\"stages\":{\"first\":\"completed\"}}";
        backend.write(location, utf8(existing));
        backend.reset();

        // When
        store.ensureInitialized(location);

        // Then
        assertThat(backend.writeCount()).isZero();
        assertThat(utf8(backend.read(location))).isEqualTo(existing);
    }

    @Test
    void scenario_FreshLocation_StartThenCompleteThenRestart() {
        StageName step1 = StageName.of("step1");

        store.ensureInitialized(location);
        assertThat(utf8(backend.read(location))).isEqualTo(EMPTY_DOCUMENT);

        assertThat(store.get(location, step1)).isEqualTo(StageState.UNSET);

        assertThat(store.set(location, step1, StageStatus.STARTED))
                .isEqualTo(new StageResult(StageState.STARTED, true));
        assertThat(utf8(backend.read(location)))
                .isEqualTo("{\"version\":\"v1\",\"stages\":{\"step1\":\"started\"}}");

        assertThat(store.set(location, step1, StageStatus.COMPLETED))
                .isEqualTo(new StageResult(StageState.COMPLETED, true));

        assertThat(store.set(location, step1, StageStatus.STARTED))
                .isEqualTo(new StageResult(StageState.COMPLETED, false));
        assertThat(store.get(location, step1)).isEqualTo(StageState.COMPLETED);
    }

    @Test
    void set_AfterCompleted_NeverReopensOrWrites() {
        // Given
        StageName stage = StageName.of("deploy");
        store.set(location, stage, StageStatus.COMPLETED);
        backend.reset();

        // When
        StageResult restart = store.set(location, stage, StageStatus.STARTED);
        StageResult complete = store.set(location, stage, StageStatus.COMPLETED);

        // Then
        assertThat(restart).isEqualTo(new StageResult(StageState.COMPLETED, false));
        assertThat(complete).isEqualTo(new StageResult(StageState.COMPLETED, false));
        assertThat(backend.writeCount()).isZero();
    }

    @Test
    void set_EqualState_DoesNotWriteOrTouchOtherStages() {
        // Given
        store.set(location, StageName.of("a"), StageStatus.STARTED);
        store.set(location, StageName.of("b"), StageStatus.COMPLETED);
        String before = utf8(backend.read(location));
        backend.reset();

        // When
        StageResult result = store.set(location, StageName.of("a"), StageStatus.STARTED);

        // Then
        assertThat(result).isEqualTo(new StageResult(StageState.STARTED, false));
        assertThat(backend.writeCount()).isZero();
        assertThat(utf8(backend.read(location))).isEqualTo(before);
    }

    @Test
    void set_OneStage_LeavesOtherStagesUntouched() {
        // Given
        StageName a = StageName.of("a");
        StageName b = StageName.of("b");
        store.set(location, b, StageStatus.STARTED);

        // When
        store.set(location, a, StageStatus.COMPLETED);

        // Then
        assertThat(store.get(location, a)).isEqualTo(StageState.COMPLETED);
        assertThat(store.get(location, b)).isEqualTo(StageState.STARTED);
    }

    @Test
    void get_MissingDocument_ReturnsUnsetWithoutCreatingIt() {
        // When
        StageState state = store.get(location, StageName.of("step1"));

        // Then
        assertThat(state).isEqualTo(StageState.UNSET);
        assertThat(backend.exists(location)).isFalse();
    }

    @Test
    void malformedDocument_IsSurfacedAndNeverReplaced() {
        // Given
        backend.write(location, utf8("not json"));
        backend.reset();

        // When & Then
        MalformedDocumentException thrown = catchThrowableOfType(
                () -> store.get(location, StageName.of("step1")), MalformedDocumentException.class);
        assertThat(thrown.location()).isEqualTo(location);
        assertThatThrownBy(() -> store.set(location, StageName.of("step1"), StageStatus.STARTED))
                .isInstanceOf(MalformedDocumentException.class);
        assertThat(store.ensureInitialized(location)).isFalse();
        assertThat(backend.writeCount()).isZero();
        assertThat(utf8(backend.read(location))).isEqualTo("not json");
    }

    @Test
    void readOnlyGet_And_Preview_NeverWrite() {
        // Given
        StageName stage = StageName.of("step1");
        store.set(location, stage, StageStatus.STARTED);
        backend.reset();

        // When
        StageResult readOnly = store.readOnlyGet(location, stage, StageStatus.COMPLETED);
        StageResult preview = store.preview(location, stage, StageStatus.COMPLETED);

        // Then
        assertThat(readOnly).isEqualTo(new StageResult(StageState.STARTED, false));
        assertThat(preview).isEqualTo(new StageResult(StageState.COMPLETED, true));
        assertThat(backend.writeCount()).isZero();
        assertThat(store.get(location, stage)).isEqualTo(StageState.STARTED);
    }
}
