package com.voicetutor.domain.actor.model.valobj;

/**
 * 指令中的一个固定段落。
 */
public record PromptSection(String header, String body) {

    public String render() {
        return header + "\n" + body;
    }
}
