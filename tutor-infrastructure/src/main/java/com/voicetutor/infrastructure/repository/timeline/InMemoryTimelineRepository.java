package com.voicetutor.infrastructure.repository.timeline;

import com.google.common.cache.CacheBuilder;
import com.voicetutor.domain.timeline.adapter.repository.ITimelineRepository;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 内存时间线仓储。
 * <p>
 * 每个会话一个时间线分片，分片内的计数器、事件列表与 eventId 索引由同一把锁保护；不同会话并行。
 * maxEventIdsPerSession 大于 0 时 eventId 索引改用 Guava Cache 限制容量，被淘汰的 eventId 再次追加会生成新记录。
 * </p>
 */
@Slf4j
@Repository
public class InMemoryTimelineRepository implements ITimelineRepository {

    private final ConcurrentMap<String, SessionTimeline> timelines = new ConcurrentHashMap<>();
    private final long maxEventIdsPerSession;

    public InMemoryTimelineRepository() {
        this(0L);
    }

    @Autowired
    public InMemoryTimelineRepository(@Value("${tutor.timeline.max-event-ids-per-session:0}") long maxEventIdsPerSession) {
        this.maxEventIdsPerSession = Math.max(maxEventIdsPerSession, 0L);
    }

    @Override
    public long append(String sessionId, TimelineEventEntity event) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "sessionId 不能为空");
        }
        if (event == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "event 不能为空");
        }
        return timelines.computeIfAbsent(sessionId, key -> new SessionTimeline(newEventIdIndex()))
                .append(sessionId, event);
    }

    @Override
    public List<TimelineEventEntity> list(String sessionId) {
        SessionTimeline timeline = sessionId == null ? null : timelines.get(sessionId);
        if (timeline == null) {
            return Collections.emptyList();
        }
        return timeline.snapshot();
    }

    @Override
    public Long findSeqByEventId(String sessionId, String eventId) {
        if (StringUtils.isBlank(eventId) || sessionId == null) {
            return null;
        }
        SessionTimeline timeline = timelines.get(sessionId);
        return timeline == null ? null : timeline.findSeq(eventId);
    }

    private Map<String, Long> newEventIdIndex() {
        if (maxEventIdsPerSession <= 0L) {
            return new HashMap<>();
        }
        return CacheBuilder.newBuilder()
                .concurrencyLevel(1)
                .maximumSize(maxEventIdsPerSession)
                .<String, Long>build()
                .asMap();
    }

    private static final class SessionTimeline {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<TimelineEventEntity> events = new ArrayList<>();
        private final Map<String, Long> eventIdIndex;
        private long lastSeq;

        private SessionTimeline(Map<String, Long> eventIdIndex) {
            this.eventIdIndex = eventIdIndex;
        }

        private long append(String sessionId, TimelineEventEntity event) {
            lock.lock();
            try {
                if (event.hasEventId()) {
                    Long existing = eventIdIndex.get(event.getEventId());
                    if (existing != null) {
                        log.info("TIMELINE_APPEND_DEDUPLICATED sessionId={}, eventId={}, seq={}",
                                sessionId, event.getEventId(), existing);
                        return existing;
                    }
                }
                long seq = ++lastSeq;
                TimelineEventEntity stored = event.copy();
                stored.setSeq(seq);
                stored.setSessionId(sessionId);
                events.add(stored);
                if (event.hasEventId()) {
                    eventIdIndex.put(event.getEventId(), seq);
                }
                return seq;
            } finally {
                lock.unlock();
            }
        }

        private List<TimelineEventEntity> snapshot() {
            lock.lock();
            try {
                List<TimelineEventEntity> copies = new ArrayList<>(events.size());
                for (TimelineEventEntity event : events) {
                    copies.add(event.copy());
                }
                return copies;
            } finally {
                lock.unlock();
            }
        }

        private Long findSeq(String eventId) {
            lock.lock();
            try {
                return eventIdIndex.get(eventId);
            } finally {
                lock.unlock();
            }
        }
    }
}
