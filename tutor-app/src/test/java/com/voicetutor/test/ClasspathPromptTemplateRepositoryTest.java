package com.voicetutor.test;

import com.voicetutor.domain.actor.model.valobj.ActorPrompt;
import com.voicetutor.domain.actor.model.valobj.ActorSessionContext;
import com.voicetutor.domain.actor.model.valobj.ActorSettings;
import com.voicetutor.domain.actor.service.ActorPromptDomainService;
import com.voicetutor.domain.actor.service.PromptTemplateParser;
import com.voicetutor.domain.director.model.valobj.BeatLibrary;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.director.service.DirectorPolicyDomainService;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.infrastructure.template.ClasspathPromptTemplateRepository;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ClasspathPromptTemplateRepositoryTest {

    private ClasspathPromptTemplateRepository repository;

    @BeforeEach
    public void setUp() {
        this.repository = new ClasspathPromptTemplateRepository(new PathMatchingResourcePatternResolver(), "classpath:prompts/");
    }

    @Test
    public void shouldLoadBundledRolesAndBeats() {
        assertEquals(Set.of("host", "economist", "skeptic"), repository.roleNames());
        assertEquals(new HashSet<>(BeatLibrary.defaultBeats()), repository.beatNames());
        assertNotNull(repository.findRoleTemplate("economist"));
        assertNull(repository.findRoleTemplate("villain"));
        assertNull(repository.findBeatTemplate(null));
    }

    @Test
    public void shouldAssembleValidInstructionsForEveryBundledPair() {
        ActorPromptDomainService actorPromptDomainService =
                new ActorPromptDomainService(repository, new PromptTemplateParser(), ActorSettings.defaults());
        DirectorPolicyDomainService policy = new DirectorPolicyDomainService();
        SessionStateEntity state = new SessionStateEntity();
        state.setSessionId("S1");
        state.setMainObjective("机会成本");
        state.setMetaphor("周末只能选一场电影");

        for (String role : repository.roleNames()) {
            for (String beat : repository.beatNames()) {
                DirectorPlan plan = policy.fallbackPlan(state, DirectorSettings.defaults(), "probe");
                plan.setNextRole(role);
                plan.setNextBeat(beat);
                plan.setOutputAction(BeatLibrary.outputActionOf(beat));

                ActorPrompt prompt = actorPromptDomainService.buildPrompt(plan, ActorSessionContext.from(state, "turn-1", "嗯"));

                assertFalse(prompt.isFallback(), role + "/" + beat);
                assertEquals("profile", prompt.getDebug().getRoleEssenceSource(), role);
                assertEquals("fenced_block", prompt.getDebug().getBeatGuidanceSource(), beat);
                assertFalse(prompt.getInstructions().contains("{concept}"));
                assertFalse(prompt.getInstructions().contains("{metaphor}"));
                assertTrue(prompt.getInstructions().length() <= ActorSettings.defaults().getMaxPromptLength());
            }
        }
    }

    @Test
    public void shouldFailWhenLocationHasNoTemplates() {
        AppException ex = assertThrows(AppException.class,
                () -> new ClasspathPromptTemplateRepository(new PathMatchingResourcePatternResolver(), "classpath:no-such-prompts"));

        assertEquals(ResponseCode.TEMPLATE_NOT_FOUND.getCode(), ex.getCode());
    }

    @Test
    public void shouldCloseTemplateStreamsAfterLoading() throws Exception {
        List<TrackedStream> opened = new ArrayList<>();
        ResourcePatternResolver resolver = mock(ResourcePatternResolver.class);
        when(resolver.getResources(anyString())).thenAnswer(invocation -> {
            String pattern = invocation.getArgument(0);
            if (pattern.contains("/roles/")) {
                return new Resource[]{template("host.md", "## 角色档案\n热情的主持人", opened)};
            }
            return new Resource[]{template("check.md", "## Prompt Template\n检查理解", opened)};
        });

        ClasspathPromptTemplateRepository repository = new ClasspathPromptTemplateRepository(resolver, "classpath:prompts");

        assertEquals(Set.of("host"), repository.roleNames());
        assertEquals(Set.of("check"), repository.beatNames());
        assertTrue(repository.findRoleTemplate("host").contains("热情的主持人"));
        assertEquals(2, opened.size());
        for (TrackedStream stream : opened) {
            assertTrue(stream.closed);
        }
    }

    private Resource template(String filename, String content, List<TrackedStream> opened) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return new ByteArrayResource(bytes) {
            @Override
            public String getFilename() {
                return filename;
            }

            @Override
            public InputStream getInputStream() {
                TrackedStream stream = new TrackedStream(new ByteArrayInputStream(bytes));
                opened.add(stream);
                return stream;
            }
        };
    }

    private static class TrackedStream extends FilterInputStream {

        private boolean closed;

        TrackedStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }
}
