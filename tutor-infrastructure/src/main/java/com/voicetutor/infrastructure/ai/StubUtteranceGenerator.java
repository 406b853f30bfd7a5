package com.voicetutor.infrastructure.ai;

import com.voicetutor.domain.actor.adapter.gateway.IUtteranceGenerator;
import com.voicetutor.domain.actor.model.valobj.UtteranceRequest;

/**
 * 不接模型时的固定确认语。
 */
public class StubUtteranceGenerator implements IUtteranceGenerator {

    public static final String ACKNOWLEDGEMENT = "收到。先用一句话复述你的理解，我们再往下走。";

    @Override
    public String generate(UtteranceRequest request) {
        return ACKNOWLEDGEMENT;
    }
}
