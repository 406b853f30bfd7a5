package com.voicetutor.domain.timeline.adapter.repository;

import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;

import java.util.List;

/**
 * 时间线仓储接口。
 * <p>
 * 同一会话内的追加操作必须串行；不同会话互不影响。
 * </p>
 *
 * @author voicetutor
 * @since 2026-03-02
 */
public interface ITimelineRepository {

    /**
     * 追加事件并返回序号。
     * <p>
     * 事件携带的 eventId 在该会话已出现过时，直接返回原序号，不产生新记录。
     * 仓储保存的是入参的拷贝，调用方后续修改入参不影响历史。
     * </p>
     */
    long append(String sessionId, TimelineEventEntity event);

    /**
     * 按序号升序返回会话全部事件的拷贝；会话没有事件时返回空列表。
     */
    List<TimelineEventEntity> list(String sessionId);

    /**
     * 查询 eventId 已分配的序号，未出现过返回 null。
     */
    Long findSeqByEventId(String sessionId, String eventId);
}
