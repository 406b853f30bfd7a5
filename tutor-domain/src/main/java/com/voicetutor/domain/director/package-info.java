/**
 * Director 领域 - 导演决策
 *
 * <p>职责：根据会话快照与最新输入，决定下一轮由哪个角色、用哪个节拍、做什么输出动作，
 * 并给出对话时长预算与张力/负荷调节目标。导演本身无状态，所有记忆都在快照里。</p>
 *
 * <h3>策略实现</h3>
 * <ul>
 *   <li>HeuristicDirectorService - 本地规则</li>
 *   <li>委托实现位于基础设施层，通过 {@link com.voicetutor.domain.director.adapter.gateway.IDirectorDecisionGateway} 调用外部模型</li>
 * </ul>
 *
 * <p>两种实现都经过 {@link com.voicetutor.domain.director.service.DirectorPolicyDomainService#applyGuardrails}
 * 收口：节拍与角色必须在可用集合内，输出时钟超限时必须选择产出型动作。</p>
 *
 * @author voicetutor
 * @since 2026-03-04
 */
package com.voicetutor.domain.director;
