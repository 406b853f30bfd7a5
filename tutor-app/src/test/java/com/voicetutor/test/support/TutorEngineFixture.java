package com.voicetutor.test.support;

import com.google.common.util.concurrent.Striped;
import com.voicetutor.domain.actor.adapter.gateway.IUtteranceGenerator;
import com.voicetutor.domain.actor.model.valobj.ActorSettings;
import com.voicetutor.domain.actor.service.ActorPromptDomainService;
import com.voicetutor.domain.actor.service.PromptTemplateParser;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.director.service.DirectorPolicyDomainService;
import com.voicetutor.domain.director.service.DirectorService;
import com.voicetutor.domain.director.service.HeuristicDirectorService;
import com.voicetutor.domain.session.model.valobj.LearningEntry;
import com.voicetutor.domain.session.service.SessionLifecycleDomainService;
import com.voicetutor.domain.session.service.SessionReducerDomainService;
import com.voicetutor.infrastructure.ai.StubUtteranceGenerator;
import com.voicetutor.infrastructure.repository.session.InMemoryLearningEntryRepository;
import com.voicetutor.infrastructure.repository.session.InMemorySessionStateRepository;
import com.voicetutor.infrastructure.repository.timeline.InMemoryTimelineRepository;
import com.voicetutor.infrastructure.template.ClasspathPromptTemplateRepository;
import com.voicetutor.trigger.application.command.SessionCommandService;
import com.voicetutor.trigger.application.command.SessionEventCommandService;
import com.voicetutor.trigger.application.common.DirectorDecisionSupport;
import com.voicetutor.trigger.application.query.SessionQueryService;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.locks.Lock;

public class TutorEngineFixture {

    public static final String ENTRY_ID = "opportunity_cost";
    public static final LocalDateTime START = LocalDateTime.of(2026, 3, 2, 10, 0, 0);

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryTimelineRepository timelineRepository = new InMemoryTimelineRepository();
    public final InMemorySessionStateRepository sessionStateRepository = new InMemorySessionStateRepository();
    public final InMemoryLearningEntryRepository learningEntryRepository =
            new InMemoryLearningEntryRepository(List.of(opportunityCostEntry()));
    public final SessionReducerDomainService reducer = new SessionReducerDomainService();
    public final DirectorPolicyDomainService policy = new DirectorPolicyDomainService();
    public final DirectorSettings directorSettings = DirectorSettings.defaults();
    public final ActorPromptDomainService actorPromptDomainService = new ActorPromptDomainService(
            new ClasspathPromptTemplateRepository(new PathMatchingResourcePatternResolver(), "classpath:prompts"),
            new PromptTemplateParser(),
            ActorSettings.defaults());
    public final Striped<Lock> sessionLocks = Striped.lazyWeakLock(8);

    public static LearningEntry opportunityCostEntry() {
        return LearningEntry.builder()
                .entryId(ENTRY_ID)
                .domain("economics")
                .title("机会成本")
                .subtitle("选择的真实代价")
                .roles(List.of("host", "economist", "skeptic"))
                .metaphor("周末只能选一场电影")
                .build();
    }

    public DirectorDecisionSupport decisionSupport(DirectorService directorService) {
        return new DirectorDecisionSupport(directorService, policy, directorSettings);
    }

    public DirectorDecisionSupport heuristicDecisionSupport() {
        return decisionSupport(new HeuristicDirectorService(policy));
    }

    public SessionCommandService sessionCommandService() {
        return new SessionCommandService(learningEntryRepository,
                sessionStateRepository,
                timelineRepository,
                new SessionLifecycleDomainService(),
                reducer,
                clock);
    }

    public SessionEventCommandService eventCommandService(DirectorService directorService, IUtteranceGenerator generator) {
        return new SessionEventCommandService(timelineRepository,
                sessionStateRepository,
                reducer,
                decisionSupport(directorService),
                actorPromptDomainService,
                generator,
                sessionLocks,
                clock);
    }

    public SessionEventCommandService eventCommandService() {
        return eventCommandService(new HeuristicDirectorService(policy), new StubUtteranceGenerator());
    }

    public SessionQueryService sessionQueryService() {
        return new SessionQueryService(sessionStateRepository,
                timelineRepository,
                learningEntryRepository,
                reducer,
                heuristicDecisionSupport(),
                actorPromptDomainService,
                clock);
    }
}
