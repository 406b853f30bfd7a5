package com.voicetutor.infrastructure.ai;

import com.voicetutor.domain.director.adapter.gateway.IDirectorDecisionGateway;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import org.springframework.ai.chat.client.ChatClient;

/**
 * 基于 Spring AI ChatClient 的导演决策网关。
 */
public class ChatClientDirectorDecisionGateway implements IDirectorDecisionGateway {

    private final ChatClient chatClient;

    public ChatClientDirectorDecisionGateway(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String requestDecision(String systemPrompt, String userPrompt) {
        try {
            ChatClient.CallResponseSpec response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call();
            return response == null ? null : response.content();
        } catch (AppException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, "Director decision request failed", ex);
        }
    }
}
