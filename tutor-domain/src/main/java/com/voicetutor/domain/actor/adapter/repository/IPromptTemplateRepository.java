package com.voicetutor.domain.actor.adapter.repository;

import java.util.Set;

/**
 * 角色/节拍模板仓储。
 *
 * @author voicetutor
 * @since 2026-03-05
 */
public interface IPromptTemplateRepository {

    /**
     * 角色模板原文，不存在返回 null。
     */
    String findRoleTemplate(String role);

    /**
     * 节拍模板原文，不存在返回 null。
     */
    String findBeatTemplate(String beat);

    Set<String> roleNames();

    Set<String> beatNames();
}
