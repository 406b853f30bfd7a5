/**
 * Timeline 领域 - 会话事件时间线
 *
 * <p>职责：按会话追加不可变事实，分配单调递增的序号，并按事件 ID 幂等去重。</p>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>{@link com.voicetutor.domain.timeline.model.entity.TimelineEventEntity} - 时间线事件</li>
 * </ul>
 *
 * <h3>仓储</h3>
 * <ul>
 *   <li>{@link com.voicetutor.domain.timeline.adapter.repository.ITimelineRepository} - append / list</li>
 * </ul>
 *
 * @author voicetutor
 * @since 2026-03-02
 */
package com.voicetutor.domain.timeline;
