package com.voicetutor.config;

import com.voicetutor.types.enums.DirectorModeEnum;
import com.voicetutor.types.enums.GeneratorModeEnum;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 编排引擎配置属性，前缀 tutor。
 *
 * @author voicetutor
 * @since 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "tutor", ignoreInvalidFields = true)
public class TutorProperties {

    private Director director = new Director();

    private Actor actor = new Actor();

    private Generator generator = new Generator();

    /** 学习入口目录 */
    private List<Entry> entries = new ArrayList<>();

    @Data
    public static class Director {

        /** heuristic：本地规则；delegated：委托大模型 */
        private DirectorModeEnum mode = DirectorModeEnum.HEURISTIC;

        private long outputClockThresholdSec = 90L;

        private int defaultTalkBurstLimitSec = 20;

        private int highLoadTalkBurstLimitSec = 15;

        /** 张力/负荷高于该值视为偏高 */
        private int highLoadThreshold = 7;

        /** 张力/负荷低于该值视为偏低 */
        private int lowLoadThreshold = 4;

        private List<String> availableRoles = new ArrayList<>(Arrays.asList("host", "economist", "skeptic"));

        /** 为空时使用节拍库全集 */
        private List<String> availableBeats = new ArrayList<>();

        /** 委托决策的软超时 */
        private long decisionTimeoutMs = 8000L;
    }

    @Data
    public static class Actor {

        private int maxPromptLength = 2000;

        private int profileFallbackLines = 5;

        private int fallbackTalkBurstLimitSec = 20;

        private String defaultMetaphor = "一个生活中的例子";

        private String templatesLocation = "classpath:prompts";
    }

    @Data
    public static class Generator {

        /** stub：固定确认语；llm：调用大模型 */
        private GeneratorModeEnum mode = GeneratorModeEnum.STUB;

        private long timeoutMs = 15000L;
    }

    @Data
    public static class Entry {
        private String entryId;
        private String domain;
        private String title;
        private String subtitle;
        private List<String> roles = new ArrayList<>();
        private String metaphor;
        private List<Question> diagnose = new ArrayList<>();
    }

    @Data
    public static class Question {
        private String questionId;
        private String prompt;
        private List<String> options = new ArrayList<>();
    }
}
