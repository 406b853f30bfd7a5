package com.voicetutor.infrastructure.ai;

import com.voicetutor.domain.actor.adapter.gateway.IUtteranceGenerator;
import com.voicetutor.domain.actor.model.valobj.UtteranceRequest;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;

import java.util.concurrent.ExecutorService;

/**
 * 调用大模型生成助手话术：角色指令作为 system，用户最新输入作为 user。
 */
@Slf4j
public class ChatClientUtteranceGenerator implements IUtteranceGenerator {

    private static final String EMPTY_USER_TEXT = "(学习者暂未开口，请开场)";

    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final long softTimeoutMs;

    public ChatClientUtteranceGenerator(ChatClient chatClient, ExecutorService executor, long softTimeoutMs) {
        this.chatClient = chatClient;
        this.executor = executor;
        this.softTimeoutMs = Math.max(softTimeoutMs, 0L);
    }

    @Override
    public String generate(UtteranceRequest request) {
        String userText = StringUtils.defaultIfBlank(request.userText(), EMPTY_USER_TEXT);
        long startedAt = System.currentTimeMillis();
        String content = SoftTimeoutInvoker.invoke(executor,
                () -> chatClient.prompt()
                        .system(request.instructions())
                        .user(userText)
                        .call()
                        .content(),
                softTimeoutMs,
                "Utterance generation");
        if (StringUtils.isBlank(content)) {
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, "Utterance generation returned blank content");
        }
        log.debug("UTTERANCE_GENERATED sessionId={}, role={}, chars={}, costMs={}",
                request.sessionId(), request.role(), content.length(), System.currentTimeMillis() - startedAt);
        return content.trim();
    }
}
