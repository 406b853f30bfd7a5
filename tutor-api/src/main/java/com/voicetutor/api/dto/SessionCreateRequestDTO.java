package com.voicetutor.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

/**
 * 开启会话请求 DTO。
 */
@Data
public class SessionCreateRequestDTO {

    @JsonAlias("entry_id")
    private String entryId;
}
