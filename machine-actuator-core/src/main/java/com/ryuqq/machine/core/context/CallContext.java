package com.ryuqq.machine.core.context;

import com.ryuqq.machine.core.exception.ContextCancelledException;
import com.ryuqq.machine.core.model.ClusterRef;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 동사 호출 하나에 딸린 컨텍스트.
 *
 * <p>클러스터 참조, 선택적 마감 시간, 취소 플래그를 담습니다.
 * Actuator는 이 컨텍스트를 해석하지 않고 Scope와 Reconciler에 그대로 전달합니다.
 * 취소된 호출은 {@link ContextCancelledException}으로 드러나며 다른 실패와 같은 경로로 보고됩니다.</p>
 *
 * <p><strong>동시성:</strong> {@link #cancel()}은 다른 스레드에서 호출해도 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CallContext {

    private final ClusterRef cluster;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled;

    private CallContext(ClusterRef cluster, Instant deadline, Clock clock, AtomicBoolean cancelled) {
        if (cluster == null) {
            throw new IllegalArgumentException("cluster cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.cluster = cluster;
        this.deadline = deadline;
        this.clock = clock;
        this.cancelled = cancelled;
    }

    /**
     * 마감 시간 없는 컨텍스트 생성.
     *
     * @param cluster 클러스터 참조
     * @return CallContext 인스턴스
     */
    public static CallContext of(ClusterRef cluster) {
        return new CallContext(cluster, null, Clock.systemUTC(), new AtomicBoolean(false));
    }

    /**
     * 마감 시간을 지정한 새 컨텍스트 생성.
     *
     * <p>취소 플래그는 원본과 공유합니다.</p>
     *
     * @param deadline 마감 시각
     * @param clock 현재 시각 기준
     * @return 새 CallContext 인스턴스
     */
    public CallContext withDeadline(Instant deadline, Clock clock) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        return new CallContext(cluster, deadline, clock, cancelled);
    }

    public ClusterRef getCluster() {
        return cluster;
    }

    /**
     * 컨텍스트 취소.
     */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * 취소되었거나 마감 시간이 지났는지 확인.
     *
     * @return 더 이상 진행하면 안 되는 경우 true
     */
    public boolean isDone() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /**
     * 컨텍스트가 살아있는지 확인.
     *
     * @throws ContextCancelledException 취소되었거나 마감 시간이 지난 경우
     */
    public void checkActive() {
        if (cancelled.get()) {
            throw new ContextCancelledException("context cancelled");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new ContextCancelledException("context deadline exceeded");
        }
    }
}
