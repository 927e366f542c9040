package com.ryuqq.machine.application.actuator;

import com.ryuqq.machine.core.context.CallContext;
import com.ryuqq.machine.core.exception.ScopeAcquisitionException;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.outcome.Existence;
import com.ryuqq.machine.core.outcome.ExistsOutcome;
import com.ryuqq.machine.core.outcome.Fail;
import com.ryuqq.machine.core.outcome.MachineError;
import com.ryuqq.machine.core.outcome.Ok;
import com.ryuqq.machine.core.outcome.Outcome;
import com.ryuqq.machine.core.scope.MachineScope;
import com.ryuqq.machine.core.spi.EventRecorder;
import com.ryuqq.machine.core.spi.EventSeverity;
import com.ryuqq.machine.core.spi.MachineReconciler;
import com.ryuqq.machine.core.spi.MachineStore;
import com.ryuqq.machine.core.spi.MachineValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.function.Consumer;

/**
 * Scope 기반 Actuator 구현체.
 *
 * <p>동사마다 Scope 획득 → Reconciler 호출 → 오류 분류/이벤트 → Scope close를 조정합니다.</p>
 *
 * <p><strong>동사별 동작:</strong></p>
 * <pre>
 * create/update:  acquire ─ 실패 → FailedX 경고 이벤트 + Fail (reconciler 호출 없음, close 없음)
 *                    │
 *                 reconcile ─ 실패 → FailedX 경고 이벤트 + Fail (close 없음, 변경 폐기)
 *                    │
 *                 X 정상 이벤트 → close ─ 실패 → Fail (추가 이벤트 없음)
 *                    │
 *                   Ok
 *
 * exists:         acquire → reconcile → Existence  (close 없음, 이벤트 없음)
 * delete:         acquire → reconcile → Delete 정상 이벤트 → Ok  (close 없음)
 * </pre>
 *
 * <p><strong>오류 처리:</strong> 모든 실패는 로그로 남기고, 이벤트 action이 있으면 경고 이벤트를
 * 정확히 하나 보내고, 동사별 {@link MachineError}를 담은 {@link Fail}로 반환합니다.
 * 재시도나 억제는 하지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 호출마다 변경되는 필드가 없어 서로 다른 Machine에 대한
 * 동시 호출에 잠금이 필요 없습니다. 같은 Machine의 호출 순서는 호스트 컨트롤러가 보장합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MachineActuator implements Actuator {

    private static final Logger log = LoggerFactory.getLogger(MachineActuator.class);

    /**
     * 로그 MDC 키 (Machine 이름).
     */
    public static final String MDC_MACHINE_KEY = "machine";

    private static final String SCOPE_FAIL_FMT = "%s: failed to create scope for machine: %s";

    private final MachineStore store;
    private final MachineReconciler reconciler;
    private final EventRecorder eventRecorder;
    private final MachineValidator validator;
    private final ActuatorConfig config;

    /**
     * 생성자 (기본 검증기, 기본 설정).
     *
     * @param store 백업 저장소
     * @param reconciler 프로바이더 Reconciler
     * @param eventRecorder 이벤트 싱크
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MachineActuator(MachineStore store, MachineReconciler reconciler, EventRecorder eventRecorder) {
        this(store, reconciler, eventRecorder, MachineValidator.acceptAll(), new ActuatorConfig());
    }

    /**
     * 생성자.
     *
     * @param store 백업 저장소
     * @param reconciler 프로바이더 Reconciler
     * @param eventRecorder 이벤트 싱크
     * @param validator Scope 획득 시 리소스 검증기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MachineActuator(
        MachineStore store,
        MachineReconciler reconciler,
        EventRecorder eventRecorder,
        MachineValidator validator,
        ActuatorConfig config
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (reconciler == null) {
            throw new IllegalArgumentException("reconciler cannot be null");
        }
        if (eventRecorder == null) {
            throw new IllegalArgumentException("eventRecorder cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.reconciler = reconciler;
        this.eventRecorder = eventRecorder;
        this.validator = validator;
        this.config = config;
    }

    @Override
    public Outcome create(CallContext context, MachineName name) {
        return execute(Verb.CREATE, context, name, reconciler::create, true);
    }

    @Override
    public ExistsOutcome exists(CallContext context, MachineName name) {
        validateInput(context, name);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_MACHINE_KEY, name.getValue())) {
            log.info("{}: {}", name, Verb.EXISTS.progressMessage());

            MachineScope scope;
            try {
                scope = acquireScope(context, name);
            } catch (ScopeAcquisitionException e) {
                return handleScopeFailure(Verb.EXISTS, name, e);
            }

            // 호스트 컨트롤러는 같은 패스에서 exists() 다음 create()/update()를 호출하며,
            // 그때 처음 가진 리소스를 그대로 사용한다. 여기서 저장하면 create()/update()가
            // 오래된 버전 토큰으로 충돌하므로 이 Scope는 close하지 않는다.
            try {
                return new Existence(name, reconciler.exists(scope));
            } catch (RuntimeException e) {
                MachineError error = Verb.EXISTS.reconcileError(e);
                return handleMachineError(name, error, Verb.EXISTS.eventAction());
            }
        }
    }

    @Override
    public Outcome update(CallContext context, MachineName name) {
        return execute(Verb.UPDATE, context, name, reconciler::update, true);
    }

    @Override
    public Outcome delete(CallContext context, MachineName name) {
        // 삭제는 Reconciler가 저장소에서 리소스를 제거하는 것으로 끝난다. 기록할 대상이 없다.
        return execute(Verb.DELETE, context, name, reconciler::delete, false);
    }

    /**
     * create/update/delete 공통 흐름.
     *
     * @param verb 동사
     * @param context 호출 컨텍스트
     * @param name 대상 Machine 이름
     * @param action Reconciler 동사 호출
     * @param commit Reconciler 성공 후 Scope를 close할지 여부
     * @return Ok 또는 Fail
     */
    private Outcome execute(
        Verb verb,
        CallContext context,
        MachineName name,
        Consumer<MachineScope> action,
        boolean commit
    ) {
        validateInput(context, name);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_MACHINE_KEY, name.getValue())) {
            log.info("{}: {}", name, verb.progressMessage());

            MachineScope scope;
            try {
                scope = acquireScope(context, name);
            } catch (ScopeAcquisitionException e) {
                return handleScopeFailure(verb, name, e);
            }

            try {
                action.accept(scope);
            } catch (RuntimeException e) {
                MachineError error = verb.reconcileError(e);
                return handleMachineError(name, error, verb.eventAction());
            }

            String message = String.format(verb.successFormat(), name);
            eventRecorder.eventf(name, EventSeverity.NORMAL, verb.eventAction(), verb.successFormat(), name);

            if (commit) {
                try {
                    scope.close();
                } catch (RuntimeException e) {
                    // 성공 이벤트는 이미 나갔다. 커밋 실패는 이벤트 없이 동사의 최종 오류가 된다.
                    MachineError error = verb.error(FailureClassifier.describe(e), FailureClassifier.commit(e));
                    return handleMachineError(name, error, Verb.NO_EVENT_ACTION);
                }
            }
            return new Ok(name, message);
        }
    }

    private MachineScope acquireScope(CallContext context, MachineName name) {
        return MachineScope.acquire(store, validator, context, name, config.skipUnmodifiedCommit());
    }

    private Fail handleScopeFailure(Verb verb, MachineName name, ScopeAcquisitionException e) {
        Throwable cause = e.getCause();
        String message = String.format(SCOPE_FAIL_FMT, name, FailureClassifier.describe(cause));
        MachineError error = verb.error(message, FailureClassifier.acquisition(cause));
        return handleMachineError(name, error, verb.eventAction());
    }

    /**
     * 오류 이벤트 전송 및 로그.
     *
     * <p>eventAction이 비어 있으면 이벤트는 생략하고 로그만 남깁니다.
     * 편의상 전달받은 오류를 그대로 담은 Fail을 반환합니다.</p>
     *
     * @param name 대상 Machine 이름
     * @param error Machine 오류
     * @param eventAction 이벤트 action (빈 문자열이면 이벤트 없음)
     * @return error를 담은 Fail
     */
    private Fail handleMachineError(MachineName name, MachineError error, String eventAction) {
        if (!Verb.NO_EVENT_ACTION.equals(eventAction)) {
            eventRecorder.eventf(name, EventSeverity.WARNING, Verb.FAILED_EVENT_PREFIX + eventAction,
                "%s", error.reason().getValue());
        }

        log.error("{}: Machine error: {}", name, error.message());
        return Fail.of(error);
    }

    private void validateInput(CallContext context, MachineName name) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }
}
