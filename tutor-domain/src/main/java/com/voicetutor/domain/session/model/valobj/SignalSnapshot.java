package com.voicetutor.domain.session.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 最近一次用户输入的信号。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignalSnapshot {

    /** 用户最近一次输入的字符数 */
    private int lastUserChars;

    /** 上次助手输出到用户开口之间的毫秒数 */
    private long lastUserLatencyMs;

    public SignalSnapshot copy() {
        return new SignalSnapshot(lastUserChars, lastUserLatencyMs);
    }
}
