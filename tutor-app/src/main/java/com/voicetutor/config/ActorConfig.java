package com.voicetutor.config;

import com.voicetutor.domain.actor.adapter.gateway.IUtteranceGenerator;
import com.voicetutor.domain.actor.adapter.repository.IPromptTemplateRepository;
import com.voicetutor.domain.actor.model.valobj.ActorSettings;
import com.voicetutor.domain.actor.service.ActorPromptDomainService;
import com.voicetutor.domain.actor.service.PromptTemplateParser;
import com.voicetutor.infrastructure.ai.ChatClientUtteranceGenerator;
import com.voicetutor.infrastructure.ai.StubUtteranceGenerator;
import com.voicetutor.infrastructure.template.ClasspathPromptTemplateRepository;
import com.voicetutor.types.enums.GeneratorModeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternUtils;

import java.util.concurrent.ExecutorService;

/**
 * 演员配置：模板仓储、指令组装与话术生成器。
 *
 * @author voicetutor
 * @since 2026-03-02
 */
@Slf4j
@Configuration
public class ActorConfig {

    @Bean
    public ActorSettings actorSettings(TutorProperties properties) {
        TutorProperties.Actor actor = properties.getActor();
        return ActorSettings.builder()
                .maxPromptLength(actor.getMaxPromptLength())
                .profileFallbackLines(actor.getProfileFallbackLines())
                .fallbackTalkBurstLimitSec(actor.getFallbackTalkBurstLimitSec())
                .defaultMetaphor(actor.getDefaultMetaphor())
                .build();
    }

    @Bean
    public IPromptTemplateRepository promptTemplateRepository(ResourceLoader resourceLoader, TutorProperties properties) {
        return new ClasspathPromptTemplateRepository(
                ResourcePatternUtils.getResourcePatternResolver(resourceLoader),
                properties.getActor().getTemplatesLocation());
    }

    @Bean
    public ActorPromptDomainService actorPromptDomainService(IPromptTemplateRepository promptTemplateRepository,
                                                             PromptTemplateParser promptTemplateParser,
                                                             ActorSettings actorSettings) {
        return new ActorPromptDomainService(promptTemplateRepository, promptTemplateParser, actorSettings);
    }

    @Bean
    public IUtteranceGenerator utteranceGenerator(TutorProperties properties,
                                                  ObjectProvider<ChatModel> chatModelProvider,
                                                  @Qualifier("tutorDelegateExecutor") ExecutorService tutorDelegateExecutor) {
        TutorProperties.Generator generator = properties.getGenerator();
        if (generator.getMode() == GeneratorModeEnum.LLM) {
            ChatModel chatModel = chatModelProvider.getIfAvailable();
            if (chatModel != null) {
                log.info("UTTERANCE_GENERATOR mode=llm, timeoutMs={}", generator.getTimeoutMs());
                return new ChatClientUtteranceGenerator(ChatClient.builder(chatModel).build(), tutorDelegateExecutor, generator.getTimeoutMs());
            }
            log.warn("UTTERANCE_GENERATOR_DOWNGRADED requested=llm, actual=stub, reason=no ChatModel configured");
        }
        return new StubUtteranceGenerator();
    }
}
