package com.voicetutor.domain.director.service;

import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;

/**
 * 导演服务：根据快照与规范化事件给出下一轮计划。
 * <p>
 * 入参只读。实现不得抛出策略类异常，外部依赖失败时必须返回保守的兜底计划。
 * </p>
 */
public interface DirectorService {

    DirectorPlan decide(SessionStateEntity snapshot, TimelineEventEntity event, DirectorSettings settings);

}
