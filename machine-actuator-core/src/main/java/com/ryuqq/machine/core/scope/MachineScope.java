package com.ryuqq.machine.core.scope;

import com.ryuqq.machine.core.context.CallContext;
import com.ryuqq.machine.core.exception.ScopeAcquisitionException;
import com.ryuqq.machine.core.exception.VersionConflictException;
import com.ryuqq.machine.core.model.Machine;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.model.MachineSpec;
import com.ryuqq.machine.core.model.MachineStatus;
import com.ryuqq.machine.core.model.ResourceVersion;
import com.ryuqq.machine.core.spi.MachineStore;
import com.ryuqq.machine.core.spi.MachineValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Machine 작업 사본과 커밋 메커니즘.
 *
 * <p>동사 호출 하나 동안 Machine 리소스 사본을 독점 소유하며,
 * 명시적인 {@link #close()} 호출 시 한 번만 조건부로 저장소에 기록합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * acquire()  → 저장소에서 현재 리소스와 버전 토큰 읽기
 *    │
 *    ▼
 * setSpec()/setStatus()  → 메모리 내 사본만 변경
 *    │
 *    ├─► close()  → compareAndSwap(사본, 획득 시점 버전) 1회
 *    │
 *    └─► (close 없이 폐기)  → 변경 사항 버려짐
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>동사 호출마다 새로 만들어지며 재사용하지 않음</li>
 *   <li>인스턴스당 기록은 최대 1회, close()로만 발생</li>
 *   <li>변경이 없으면 close()는 저장소에 접근하지 않음 (skipUnmodifiedCommit=true일 때)</li>
 *   <li>버전 불일치는 {@link VersionConflictException}으로 그대로 전달, 내부 재시도 없음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 스레드 하나가 독점 사용하는 것을 전제로 하며 thread-safe하지 않습니다.</p>
 *
 * <p>{@link AutoCloseable}을 구현하지 않습니다. close 여부는 Actuator가 동사별로 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MachineScope {

    private static final Logger log = LoggerFactory.getLogger(MachineScope.class);

    private final MachineStore store;
    private final CallContext context;
    private final Machine original;
    private final boolean skipUnmodifiedCommit;

    private Machine current;
    private boolean closed;

    private MachineScope(MachineStore store, CallContext context, Machine original, boolean skipUnmodifiedCommit) {
        this.store = store;
        this.context = context;
        this.original = original;
        this.current = original;
        this.skipUnmodifiedCommit = skipUnmodifiedCommit;
    }

    /**
     * Scope 획득.
     *
     * <p>저장소에서 현재 리소스와 버전 토큰을 읽고 검증합니다.</p>
     *
     * @param store 백업 저장소
     * @param validator 리소스 검증기
     * @param context 호출 컨텍스트
     * @param name 대상 Machine 이름
     * @param skipUnmodifiedCommit 변경이 없을 때 close()가 기록을 생략할지 여부
     * @return 새 MachineScope
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws ScopeAcquisitionException 리소스를 읽거나 검증할 수 없는 경우 (원인 포함)
     */
    public static MachineScope acquire(
        MachineStore store,
        MachineValidator validator,
        CallContext context,
        MachineName name,
        boolean skipUnmodifiedCommit
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }

        Machine machine;
        try {
            context.checkActive();
            machine = store.get(name);
            validator.validate(machine);
        } catch (RuntimeException e) {
            throw new ScopeAcquisitionException(name, e);
        }

        log.debug("{}: scope acquired at {}", name, machine.getVersion().getValue());
        return new MachineScope(store, context, machine, skipUnmodifiedCommit);
    }

    public MachineName name() {
        return original.getName();
    }

    public CallContext context() {
        return context;
    }

    /**
     * 현재 작업 사본 조회.
     *
     * @return 메모리 내 Machine (획득 시점 버전 토큰 유지)
     */
    public Machine machine() {
        return current;
    }

    public MachineSpec spec() {
        return current.getSpec();
    }

    public MachineStatus status() {
        return current.getStatus();
    }

    /**
     * 원하는 상태 변경 (메모리 내 사본만).
     *
     * @param spec 새 spec
     * @throws IllegalStateException 이미 close된 경우
     */
    public void setSpec(MachineSpec spec) {
        ensureOpen();
        current = current.withSpec(spec);
    }

    /**
     * 관측된 상태 변경 (메모리 내 사본만).
     *
     * @param status 새 status
     * @throws IllegalStateException 이미 close된 경우
     */
    public void setStatus(MachineStatus status) {
        ensureOpen();
        current = current.withStatus(status);
    }

    /**
     * 획득 시점의 버전 토큰 조회.
     *
     * @return compare-and-swap에 사용될 버전 토큰
     */
    public ResourceVersion acquiredVersion() {
        return original.getVersion();
    }

    /**
     * 획득 이후 사본이 변경되었는지 확인.
     *
     * @return spec 또는 status가 달라졌으면 true
     */
    public boolean isModified() {
        return !current.sameContentAs(original);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 작업 사본을 저장소에 조건부 기록.
     *
     * <p>변경이 없고 skipUnmodifiedCommit이 켜져 있으면 저장소에 접근하지 않고 반환합니다.
     * 그 외에는 획득 시점 버전 토큰으로 compareAndSwap을 정확히 한 번 호출합니다.</p>
     *
     * @throws IllegalStateException 이미 close된 경우
     * @throws VersionConflictException 획득 이후 다른 작성자가 리소스를 변경한 경우
     * @throws com.ryuqq.machine.core.exception.MachineStoreException 전송 오류
     * @throws com.ryuqq.machine.core.exception.ContextCancelledException 컨텍스트가 취소된 경우
     */
    public void close() {
        ensureOpen();
        closed = true;

        if (skipUnmodifiedCommit && !isModified()) {
            log.debug("{}: no changes, skipping commit", name());
            return;
        }

        context.checkActive();
        Machine stored = store.compareAndSwap(current, original.getVersion());
        current = stored;
        log.debug("{}: committed {} -> {}", name(), original.getVersion().getValue(), stored.getVersion().getValue());
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("scope for machine " + name() + " is already closed");
        }
    }
}
