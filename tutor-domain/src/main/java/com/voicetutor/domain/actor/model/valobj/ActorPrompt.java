package com.voicetutor.domain.actor.model.valobj;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 组装完成的角色指令。
 */
@Data
public class ActorPrompt {

    private List<PromptSection> sections = new ArrayList<>();
    private String instructions;
    private ActorPromptDebug debug;

    public boolean isFallback() {
        return debug != null && debug.isFallback();
    }
}
