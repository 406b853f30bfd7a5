package com.voicetutor.trigger.http;

import com.voicetutor.api.dto.InstructionsDTO;
import com.voicetutor.api.dto.SessionCreateRequestDTO;
import com.voicetutor.api.dto.SessionCreateResponseDTO;
import com.voicetutor.api.dto.SessionReplayDTO;
import com.voicetutor.api.dto.SessionStateDTO;
import com.voicetutor.api.dto.TimelineEventDTO;
import com.voicetutor.api.response.Response;
import com.voicetutor.trigger.application.command.SessionCommandService;
import com.voicetutor.trigger.application.common.SessionDtoAssembler;
import com.voicetutor.trigger.application.query.SessionQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 会话 API：开启会话与读模型。
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionCommandService sessionCommandService;
    private final SessionQueryService sessionQueryService;
    private final SessionDtoAssembler sessionDtoAssembler;

    public SessionController(SessionCommandService sessionCommandService,
                             SessionQueryService sessionQueryService,
                             SessionDtoAssembler sessionDtoAssembler) {
        this.sessionCommandService = sessionCommandService;
        this.sessionQueryService = sessionQueryService;
        this.sessionDtoAssembler = sessionDtoAssembler;
    }

    @PostMapping
    public Response<SessionCreateResponseDTO> createSession(@RequestBody SessionCreateRequestDTO request) {
        String entryId = request == null ? null : request.getEntryId();
        return Response.success(sessionDtoAssembler.toCreateResponse(sessionCommandService.openSession(entryId)));
    }

    @GetMapping("/{id}")
    public Response<SessionStateDTO> getSession(@PathVariable("id") String sessionId) {
        return Response.success(sessionDtoAssembler.toState(sessionQueryService.getSnapshot(sessionId)));
    }

    @GetMapping("/{id}/timeline")
    public Response<List<TimelineEventDTO>> getTimeline(@PathVariable("id") String sessionId) {
        return Response.success(sessionDtoAssembler.toTimeline(sessionQueryService.listTimeline(sessionId)));
    }

    @GetMapping("/{id}/replay")
    public Response<SessionReplayDTO> replay(@PathVariable("id") String sessionId) {
        return Response.success(sessionDtoAssembler.toReplay(sessionQueryService.replay(sessionId)));
    }

    @GetMapping("/{id}/instructions")
    public Response<InstructionsDTO> getInstructions(@PathVariable("id") String sessionId) {
        return Response.success(sessionDtoAssembler.toInstructions(sessionQueryService.initialInstructions(sessionId)));
    }
}
