package com.voicetutor.api.dto;

import lombok.Data;

/**
 * 时间线重放结果 DTO。
 */
@Data
public class SessionReplayDTO {

    private String sessionId;
    private Integer eventCount;
    /** 重放结果与当前快照是否一致 */
    private Boolean consistent;
    private SessionStateDTO rebuilt;
}
