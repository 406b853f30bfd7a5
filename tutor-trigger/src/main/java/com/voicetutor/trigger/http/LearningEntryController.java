package com.voicetutor.trigger.http;

import com.voicetutor.api.dto.LearningEntryDTO;
import com.voicetutor.api.response.Response;
import com.voicetutor.trigger.application.common.SessionDtoAssembler;
import com.voicetutor.trigger.application.query.SessionQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 学习入口列表 API。
 */
@RestController
@RequestMapping("/api/entries")
public class LearningEntryController {

    private final SessionQueryService sessionQueryService;
    private final SessionDtoAssembler sessionDtoAssembler;

    public LearningEntryController(SessionQueryService sessionQueryService, SessionDtoAssembler sessionDtoAssembler) {
        this.sessionQueryService = sessionQueryService;
        this.sessionDtoAssembler = sessionDtoAssembler;
    }

    @GetMapping
    public Response<List<LearningEntryDTO>> listEntries() {
        return Response.success(sessionDtoAssembler.toEntries(sessionQueryService.listEntries()));
    }
}
