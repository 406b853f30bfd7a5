/**
 * Actor 领域 - 角色指令组装
 *
 * <p>职责：把导演计划、会话上下文与角色/节拍模板组装成下游生成器使用的指令文本。
 * 模板内容对本领域不透明，只按约定的段落结构抽取“角色精髓”和“节拍指引”。</p>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>PromptTemplateParser - Markdown 段落解析</li>
 *   <li>ActorPromptDomainService - 组装、校验与兜底</li>
 * </ul>
 *
 * @author voicetutor
 * @since 2026-03-05
 */
package com.voicetutor.domain.actor;
