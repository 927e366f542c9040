package com.ryuqq.machine.core.scope;

import com.ryuqq.machine.core.context.CallContext;
import com.ryuqq.machine.core.exception.ContextCancelledException;
import com.ryuqq.machine.core.exception.MachineNotFoundException;
import com.ryuqq.machine.core.exception.MachineStoreException;
import com.ryuqq.machine.core.exception.ScopeAcquisitionException;
import com.ryuqq.machine.core.exception.VersionConflictException;
import com.ryuqq.machine.core.model.ClusterRef;
import com.ryuqq.machine.core.model.Machine;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.model.MachineSpec;
import com.ryuqq.machine.core.model.MachineStatus;
import com.ryuqq.machine.core.model.ResourceVersion;
import com.ryuqq.machine.core.spi.MachineStore;
import com.ryuqq.machine.core.spi.MachineValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * MachineScope 유닛 테스트.
 *
 * <p>Scope의 커밋 프로토콜을 검증합니다:</p>
 * <ul>
 *   <li>획득 실패는 원인을 담은 ScopeAcquisitionException</li>
 *   <li>변경 없으면 close()가 저장소에 접근하지 않음</li>
 *   <li>변경 있으면 획득 시점 버전으로 compareAndSwap 정확히 1회</li>
 *   <li>충돌은 재시도 없이 그대로 전달</li>
 *   <li>close는 인스턴스당 1회</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class MachineScopeTest {

    private static final MachineName NAME = MachineName.of("m1");
    private static final ResourceVersion V1 = ResourceVersion.of("1");
    private static final ResourceVersion V2 = ResourceVersion.of("2");

    @Mock
    private MachineStore store;

    private CallContext context;
    private Machine stored;

    @BeforeEach
    void setUp() {
        context = CallContext.of(ClusterRef.of("c1"));
        stored = Machine.of(NAME, MachineSpec.of(Map.of("zone", "zone-a")), MachineStatus.empty(), V1);
    }

    private MachineScope acquire(boolean skipUnmodifiedCommit) {
        when(store.get(NAME)).thenReturn(stored);
        return MachineScope.acquire(store, MachineValidator.acceptAll(), context, NAME, skipUnmodifiedCommit);
    }

    // ============================================================
    // 1. 획득
    // ============================================================

    @Test
    void acquire_저장소의_현재_리소스와_버전을_보관함() {
        // when
        MachineScope scope = acquire(true);

        // then
        assertThat(scope.name()).isEqualTo(NAME);
        assertThat(scope.machine()).isEqualTo(stored);
        assertThat(scope.acquiredVersion()).isEqualTo(V1);
        assertThat(scope.isModified()).isFalse();
        assertThat(scope.isClosed()).isFalse();
    }

    @Test
    void acquire_리소스가_없으면_원인을_담아_실패() {
        // given
        MachineNotFoundException notFound = new MachineNotFoundException(NAME);
        when(store.get(NAME)).thenThrow(notFound);

        // when & then
        assertThatThrownBy(() -> MachineScope.acquire(store, MachineValidator.acceptAll(), context, NAME, true))
            .isInstanceOf(ScopeAcquisitionException.class)
            .hasCause(notFound)
            .hasMessageContaining("not found");
    }

    @Test
    void acquire_검증_실패시_ScopeAcquisitionException() {
        // given
        when(store.get(NAME)).thenReturn(stored);
        MachineValidator validator = MachineValidator.requireProviderSpecKeys("image");

        // when & then
        assertThatThrownBy(() -> MachineScope.acquire(store, validator, context, NAME, true))
            .isInstanceOf(ScopeAcquisitionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("image");
    }

    @Test
    void acquire_취소된_컨텍스트면_저장소를_읽지_않음() {
        // given
        context.cancel();

        // when & then
        assertThatThrownBy(() -> MachineScope.acquire(store, MachineValidator.acceptAll(), context, NAME, true))
            .isInstanceOf(ScopeAcquisitionException.class)
            .hasCauseInstanceOf(ContextCancelledException.class);
        verifyNoInteractions(store);
    }

    @Test
    void acquire_null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> MachineScope.acquire(null, MachineValidator.acceptAll(), context, NAME, true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("store cannot be null");
    }

    // ============================================================
    // 2. close: 변경 없음
    // ============================================================

    @Test
    void close_변경이_없으면_저장소에_기록하지_않음() {
        // given
        MachineScope scope = acquire(true);

        // when
        scope.close();

        // then
        verify(store, never()).compareAndSwap(any(), any());
        assertThat(scope.isClosed()).isTrue();
    }

    @Test
    void close_skipUnmodifiedCommit_false면_변경이_없어도_기록함() {
        // given
        MachineScope scope = acquire(false);
        when(store.compareAndSwap(stored, V1)).thenReturn(stored.withVersion(V2));

        // when
        scope.close();

        // then
        verify(store, times(1)).compareAndSwap(stored, V1);
    }

    // ============================================================
    // 3. close: 변경 있음
    // ============================================================

    @Test
    void close_변경이_있으면_획득_시점_버전으로_한번_기록함() {
        // given
        MachineScope scope = acquire(true);
        MachineStatus running = scope.status().withInstanceState("RUNNING");
        scope.setStatus(running);
        when(store.compareAndSwap(any(), any())).thenAnswer(invocation ->
            ((Machine) invocation.getArgument(0)).withVersion(V2));

        // when
        scope.close();

        // then
        ArgumentCaptor<Machine> written = ArgumentCaptor.forClass(Machine.class);
        verify(store, times(1)).compareAndSwap(written.capture(), eq(V1));
        assertThat(written.getValue().getStatus()).isEqualTo(running);
        assertThat(scope.machine().getVersion()).isEqualTo(V2);
    }

    @Test
    void close_버전_충돌은_재시도_없이_그대로_전달() {
        // given
        MachineScope scope = acquire(true);
        scope.setSpec(scope.spec().withProviderId("fake://m1"));
        VersionConflictException conflict = new VersionConflictException(NAME, V1, V2);
        when(store.compareAndSwap(any(), any())).thenThrow(conflict);

        // when & then
        assertThatThrownBy(scope::close).isSameAs(conflict);
        verify(store, times(1)).compareAndSwap(any(), any());
    }

    @Test
    void close_전송_오류도_그대로_전달() {
        // given
        MachineScope scope = acquire(true);
        scope.setStatus(scope.status().withInstanceState("RUNNING"));
        when(store.compareAndSwap(any(), any())).thenThrow(new MachineStoreException("connection refused"));

        // when & then
        assertThatThrownBy(scope::close)
            .isInstanceOf(MachineStoreException.class)
            .hasMessage("connection refused");
    }

    @Test
    void close_컨텍스트가_취소되면_기록하지_않고_실패() {
        // given
        MachineScope scope = acquire(true);
        scope.setStatus(scope.status().withInstanceState("RUNNING"));
        context.cancel();

        // when & then
        assertThatThrownBy(scope::close).isInstanceOf(ContextCancelledException.class);
        verify(store, never()).compareAndSwap(any(), any());
    }

    // ============================================================
    // 4. 1회성
    // ============================================================

    @Test
    void close_두번_호출하면_IllegalStateException() {
        // given
        MachineScope scope = acquire(true);
        scope.close();

        // when & then
        assertThatThrownBy(scope::close)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already closed");
    }

    @Test
    void setStatus_close_이후에는_IllegalStateException() {
        // given
        MachineScope scope = acquire(true);
        scope.close();

        // when & then
        assertThatThrownBy(() -> scope.setStatus(MachineStatus.empty()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 원래_값으로_되돌리면_변경_없음으로_판단() {
        // given
        MachineScope scope = acquire(true);
        MachineStatus original = scope.status();
        scope.setStatus(original.withInstanceState("RUNNING"));
        scope.setStatus(original);

        // then
        assertThat(scope.isModified()).isFalse();
    }
}
