package com.voicetutor.domain.actor.adapter.gateway;

import com.voicetutor.domain.actor.model.valobj.UtteranceRequest;

/**
 * 助手话术生成器。
 * <p>
 * 实现可以是固定确认语，也可以调用外部模型；失败时抛出 AppException，由编排层兜底。
 * </p>
 */
public interface IUtteranceGenerator {

    String generate(UtteranceRequest request);

}
