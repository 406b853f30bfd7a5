package com.voicetutor.domain.actor.model.valobj;

/**
 * 话术生成请求。
 *
 * @param sessionId    会话 ID
 * @param role         本轮角色
 * @param instructions 组装好的指令
 * @param userText     用户最新输入
 */
public record UtteranceRequest(String sessionId, String role, String instructions, String userText) {
}
