package com.voicetutor.domain.session.adapter.repository;

import com.voicetutor.domain.session.model.entity.SessionStateEntity;

/**
 * 会话快照仓储接口。
 *
 * @author voicetutor
 * @since 2026-03-02
 */
public interface ISessionStateRepository {

    /**
     * 按会话 ID 查询快照拷贝，不存在返回 null。
     */
    SessionStateEntity findById(String sessionId);

    /**
     * 整体替换保存快照，不做局部合并。
     */
    void save(SessionStateEntity state);

    boolean exists(String sessionId);
}
