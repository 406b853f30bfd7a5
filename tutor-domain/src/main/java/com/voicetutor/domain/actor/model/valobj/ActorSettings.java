package com.voicetutor.domain.actor.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 指令组装配置。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActorSettings {

    @Builder.Default
    private int maxPromptLength = 2000;

    /** 角色模板没有 Profile 段时，取前几行作为角色精髓 */
    @Builder.Default
    private int profileFallbackLines = 5;

    /** 兜底指令使用的通用时长 */
    @Builder.Default
    private int fallbackTalkBurstLimitSec = 20;

    /** {metaphor} 无值时的替代文本 */
    @Builder.Default
    private String defaultMetaphor = "一个生活中的例子";

    public static ActorSettings defaults() {
        return ActorSettings.builder().build();
    }
}
