package com.ryuqq.machine.adapter.inmemory.event;

import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.spi.EventRecorder;
import com.ryuqq.machine.core.spi.EventSeverity;
import com.ryuqq.machine.core.spi.LifecycleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link EventRecorder} SPI.
 *
 * <p>이벤트를 기록 순서대로 {@link CopyOnWriteArrayList}에 보관하고 DEBUG 로그로도 남깁니다.
 * 테스트에서 이벤트 개수, 심각도, action을 검증하는 데 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventRecorder implements EventRecorder {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventRecorder.class);

    private final CopyOnWriteArrayList<LifecycleEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(LifecycleEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
        log.debug("{} {} {}: {}", event.severity(), event.subject(), event.action(), event.message());
    }

    /**
     * 기록된 모든 이벤트 조회.
     *
     * @return 기록 순서대로 정렬된 불변 목록
     */
    public List<LifecycleEvent> getEvents() {
        return List.copyOf(events);
    }

    /**
     * 특정 Machine의 이벤트 조회.
     *
     * @param subject 대상 Machine
     * @return 기록 순서대로 정렬된 불변 목록
     */
    public List<LifecycleEvent> getEvents(MachineName subject) {
        return events.stream()
            .filter(event -> event.subject().equals(subject))
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 특정 심각도의 이벤트 개수.
     *
     * @param severity 심각도
     * @return 이벤트 개수
     */
    public long count(EventSeverity severity) {
        return events.stream().filter(event -> event.severity() == severity).count();
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
