/**
 * Session 领域 - 会话快照
 *
 * <p>职责：维护由时间线归约得到的会话快照，包括学习目标、学习者模型、节奏信号与对话轮次。</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.voicetutor.domain.session.model.entity.SessionStateEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>SessionReducerDomainService - 事件归约与时间线重放</li>
 *   <li>SessionLifecycleDomainService - 按学习入口开启会话</li>
 * </ul>
 *
 * @author voicetutor
 * @since 2026-03-02
 */
package com.voicetutor.domain.session;
