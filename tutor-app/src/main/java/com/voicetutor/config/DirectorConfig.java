package com.voicetutor.config;

import com.voicetutor.domain.director.model.valobj.BeatLibrary;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.director.service.DirectorPolicyDomainService;
import com.voicetutor.domain.director.service.DirectorPromptDomainService;
import com.voicetutor.domain.director.service.DirectorService;
import com.voicetutor.domain.director.service.HeuristicDirectorService;
import com.voicetutor.infrastructure.ai.ChatClientDirectorDecisionGateway;
import com.voicetutor.infrastructure.director.DelegatedDirectorServiceImpl;
import com.voicetutor.infrastructure.util.JsonCodec;
import com.voicetutor.types.enums.DirectorModeEnum;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.concurrent.ExecutorService;

/**
 * 导演配置：按 tutor.director.mode 选择规则导演或委托导演。
 * <p>
 * 委托模式下没有可用的 ChatModel 时降级为规则导演并告警，编排层对具体实现无感知。
 * </p>
 *
 * @author voicetutor
 * @since 2026-03-02
 */
@Slf4j
@Configuration
public class DirectorConfig {

    @Bean
    public DirectorSettings directorSettings(TutorProperties properties) {
        TutorProperties.Director director = properties.getDirector();
        return DirectorSettings.builder()
                .availableRoles(new ArrayList<>(director.getAvailableRoles()))
                .availableBeats(director.getAvailableBeats().isEmpty()
                        ? BeatLibrary.defaultBeats()
                        : new ArrayList<>(director.getAvailableBeats()))
                .outputClockThresholdSec(director.getOutputClockThresholdSec())
                .defaultTalkBurstLimitSec(director.getDefaultTalkBurstLimitSec())
                .highLoadTalkBurstLimitSec(director.getHighLoadTalkBurstLimitSec())
                .highLevelThreshold(director.getHighLoadThreshold())
                .lowLevelThreshold(director.getLowLoadThreshold())
                .build();
    }

    @Bean
    public DirectorService directorService(TutorProperties properties,
                                           DirectorPolicyDomainService directorPolicyDomainService,
                                           DirectorPromptDomainService directorPromptDomainService,
                                           JsonCodec jsonCodec,
                                           @Qualifier("tutorDelegateExecutor") ExecutorService tutorDelegateExecutor,
                                           ObjectProvider<ChatModel> chatModelProvider,
                                           ObjectProvider<MeterRegistry> meterRegistryProvider) {
        TutorProperties.Director director = properties.getDirector();
        if (director.getMode() == DirectorModeEnum.DELEGATED) {
            ChatModel chatModel = chatModelProvider.getIfAvailable();
            if (chatModel != null) {
                log.info("DIRECTOR_MODE mode=delegated, decisionTimeoutMs={}", director.getDecisionTimeoutMs());
                return new DelegatedDirectorServiceImpl(
                        new ChatClientDirectorDecisionGateway(ChatClient.builder(chatModel).build()),
                        directorPolicyDomainService,
                        directorPromptDomainService,
                        jsonCodec,
                        tutorDelegateExecutor,
                        director.getDecisionTimeoutMs(),
                        meterRegistryProvider.getIfAvailable());
            }
            log.warn("DIRECTOR_MODE_DOWNGRADED requested=delegated, actual=heuristic, reason=no ChatModel configured");
        }
        log.info("DIRECTOR_MODE mode=heuristic");
        return new HeuristicDirectorService(directorPolicyDomainService);
    }
}
