package com.voicetutor.trigger.http;

import com.voicetutor.api.dto.SessionEventRequestDTO;
import com.voicetutor.api.dto.SessionEventResponseDTO;
import com.voicetutor.api.response.Response;
import com.voicetutor.trigger.application.command.SessionEventCommandService;
import com.voicetutor.trigger.application.common.SessionDtoAssembler;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 会话事件上报 API：每个事件同步驱动一轮编排并返回助手回复。
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionEventController {

    private final SessionEventCommandService sessionEventCommandService;
    private final SessionDtoAssembler sessionDtoAssembler;

    public SessionEventController(SessionEventCommandService sessionEventCommandService,
                                  SessionDtoAssembler sessionDtoAssembler) {
        this.sessionEventCommandService = sessionEventCommandService;
        this.sessionDtoAssembler = sessionDtoAssembler;
    }

    @PostMapping("/{id}/events")
    public Response<SessionEventResponseDTO> submitEvent(@PathVariable("id") String sessionId,
                                                         @RequestBody SessionEventRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "事件不能为空");
        }
        SessionEventCommandService.SessionEventResult result =
                sessionEventCommandService.onEvent(sessionId, sessionDtoAssembler.toEvent(request));
        return Response.success(sessionDtoAssembler.toEventResponse(result));
    }
}
