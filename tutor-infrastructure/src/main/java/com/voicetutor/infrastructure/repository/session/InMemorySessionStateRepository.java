package com.voicetutor.infrastructure.repository.session;

import com.voicetutor.domain.session.adapter.repository.ISessionStateRepository;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存会话快照仓储，读写互斥，进出都做深拷贝。
 */
@Repository
public class InMemorySessionStateRepository implements ISessionStateRepository {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, SessionStateEntity> states = new HashMap<>();

    @Override
    public SessionStateEntity findById(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        lock.readLock().lock();
        try {
            SessionStateEntity state = states.get(sessionId);
            return state == null ? null : state.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void save(SessionStateEntity state) {
        if (state == null || StringUtils.isBlank(state.getSessionId())) {
            throw new AppException(ResponseCode.STORE_FAILURE, "会话快照缺少 sessionId");
        }
        SessionStateEntity stored = state.copy();
        lock.writeLock().lock();
        try {
            states.put(stored.getSessionId(), stored);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean exists(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        lock.readLock().lock();
        try {
            return states.containsKey(sessionId);
        } finally {
            lock.readLock().unlock();
        }
    }
}
