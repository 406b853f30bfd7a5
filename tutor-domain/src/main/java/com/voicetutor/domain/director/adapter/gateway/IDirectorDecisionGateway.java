package com.voicetutor.domain.director.adapter.gateway;

/**
 * 外部决策提供方。
 * <p>
 * 返回模型原始文本，由调用方解析；调用可能很慢或失败，调用方负责超时与兜底。
 * </p>
 */
public interface IDirectorDecisionGateway {

    String requestDecision(String systemPrompt, String userPrompt);

}
