package com.voicetutor.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话事件上报请求 DTO。type 为空时按 user_message 处理。
 */
@Data
public class SessionEventRequestDTO {

    @JsonAlias("event_id")
    private String eventId;

    @JsonAlias("turn_id")
    private String turnId;

    private String type;
    private String text;

    @JsonAlias("question_id")
    private String questionId;

    private String answer;

    @JsonAlias("client_ts")
    private LocalDateTime clientTimestamp;
}
