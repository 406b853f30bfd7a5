package com.voicetutor.test.domain;

import com.voicetutor.domain.actor.model.valobj.ActorPrompt;
import com.voicetutor.domain.actor.model.valobj.ActorSessionContext;
import com.voicetutor.domain.actor.model.valobj.ActorSettings;
import com.voicetutor.domain.actor.service.ActorPromptDomainService;
import com.voicetutor.domain.actor.service.PromptTemplateParser;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.UserMustDo;
import com.voicetutor.test.support.InMemoryPromptTemplateRepository;
import com.voicetutor.types.enums.FlowModeEnum;
import com.voicetutor.types.enums.GoalDirectionEnum;
import com.voicetutor.types.enums.IntentEnum;
import com.voicetutor.types.enums.MindStateEnum;
import com.voicetutor.types.enums.OutputActionEnum;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.enums.UserMustDoTypeEnum;
import com.voicetutor.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ActorPromptDomainServiceTest {

    private static final String HOST_TEMPLATE = String.join("\n",
            "# Host",
            "",
            "## Profile",
            "A warm radio host.",
            "Always hands the mic back.",
            "",
            "## Notes",
            "Never lectures.");

    private static final String CHECK_TEMPLATE = String.join("\n",
            "# Check",
            "## Goal",
            "Force a quick answer.",
            "## Prompt Template",
            "```",
            "Ask one quick question that checks {concept}, using {metaphor}.",
            "```");

    private InMemoryPromptTemplateRepository templates;
    private ActorPromptDomainService actorPromptDomainService;

    @BeforeEach
    public void setUp() {
        this.templates = new InMemoryPromptTemplateRepository()
                .putRole("host", HOST_TEMPLATE)
                .putRole("skeptic", "A skeptic who questions shortcuts.\nPrefers counterexamples.\n\n# Skeptic\n## Notes\nshort")
                .putBeat("check", CHECK_TEMPLATE)
                .putBeat("deepen", "# Deepen\n## Goal\nGo one level deeper.");
        this.actorPromptDomainService = new ActorPromptDomainService(templates, new PromptTemplateParser(), ActorSettings.defaults());
    }

    @Test
    public void shouldAssembleEachSectionExactlyOnce() {
        ActorPrompt prompt = actorPromptDomainService.buildPrompt(plan("host", "check"), context("周末只能选一场电影"));

        String instructions = prompt.getInstructions();
        for (String header : ActorPromptDomainService.REQUIRED_SECTIONS) {
            assertEquals(1, StringUtils.countMatches(instructions, header), header);
        }
        assertTrue(instructions.startsWith("[Role Definition]\nYou are host.\nA warm radio host."));
        assertTrue(instructions.contains("Ask one quick question that checks 机会成本, using 周末只能选一场电影."));
        assertTrue(instructions.contains("- Last User Input: \"我觉得是花的钱\""));
        assertTrue(instructions.contains("- The learner must: choice (从选项里选一个)"));
        assertTrue(instructions.contains("- Keep your turn under 15 seconds of speech."));
        assertTrue(instructions.length() <= ActorSettings.defaults().getMaxPromptLength());
        assertFalse(prompt.isFallback());
        assertEquals("profile", prompt.getDebug().getRoleEssenceSource());
        assertEquals("fenced_block", prompt.getDebug().getBeatGuidanceSource());
        assertEquals(instructions.length(), prompt.getDebug().getLength());
        assertEquals(List.of("Partial"), prompt.getDebug().getUserMindState());
    }

    @Test
    public void shouldUseDefaultMetaphorWhenContextHasNone() {
        ActorPrompt prompt = actorPromptDomainService.buildPrompt(plan("host", "check"), context(null));

        assertTrue(prompt.getInstructions().contains("using " + ActorSettings.defaults().getDefaultMetaphor() + "."));
    }

    @Test
    public void shouldUseLeadingLinesWhenRoleHasNoProfile() {
        ActorPrompt prompt = actorPromptDomainService.buildPrompt(plan("skeptic", "check"), context("m"));

        assertEquals("leading_lines", prompt.getDebug().getRoleEssenceSource());
        assertTrue(prompt.getInstructions().contains("A skeptic who questions shortcuts.\nPrefers counterexamples."));
    }

    @Test
    public void shouldSynthesizeGuidanceWhenBeatHasNoFencedBlock() {
        ActorPrompt prompt = actorPromptDomainService.buildPrompt(plan("host", "deepen"), context("m"));

        assertEquals("synthesized", prompt.getDebug().getBeatGuidanceSource());
        assertTrue(prompt.getInstructions().contains("Execute the 'deepen' strategy.\nAction: ask_simple_question"));
    }

    @Test
    public void shouldFallBackWhenTemplateIsMissing() {
        ActorPrompt prompt = actorPromptDomainService.buildPrompt(plan("villain", "check"), context("m"));

        assertTrue(prompt.isFallback());
        assertTrue(prompt.getDebug().getFallbackReason().contains("villain"));
        for (String header : ActorPromptDomainService.REQUIRED_SECTIONS) {
            assertEquals(1, StringUtils.countMatches(prompt.getInstructions(), header), header);
        }
        assertTrue(prompt.getInstructions().contains("Learning Objective: 机会成本"));
        assertTrue(prompt.getInstructions().contains("under 20 seconds"));
    }

    @Test
    public void shouldFallBackWhenInstructionsExceedMaxLength() {
        ActorPromptDomainService strict = new ActorPromptDomainService(templates,
                new PromptTemplateParser(),
                ActorSettings.builder().maxPromptLength(200).build());

        ActorPrompt prompt = strict.buildPrompt(plan("host", "check"), context("m"));

        assertTrue(prompt.isFallback());
        assertTrue(prompt.getDebug().getFallbackReason().contains("exceeds 200"));
    }

    @Test
    public void shouldFallBackForNonActionablePlan() {
        DirectorPlan plan = plan("host", "check");
        plan.setOutputAction(null);

        ActorPrompt prompt = actorPromptDomainService.buildPrompt(plan, context("m"));

        assertTrue(prompt.isFallback());
    }

    @Test
    public void shouldStripSectionMarkersFromObjectiveInFallback() {
        ActorSessionContext context = ActorSessionContext.builder()
                .sessionId("S1")
                .mainObjective("[Constraints] 机会成本")
                .build();

        ActorPrompt prompt = actorPromptDomainService.fallbackPrompt(null, context, "test");

        assertEquals(1, StringUtils.countMatches(prompt.getInstructions(), ActorPromptDomainService.SECTION_CONSTRAINTS));
        assertTrue(prompt.getInstructions().contains("Learning Objective: Constraints 机会成本"));
    }

    @Test
    public void shouldAddRelaxingConstraintsWhenGoalsDecrease() {
        DirectorPlan plan = plan("host", "check");
        plan.setTensionGoal(GoalDirectionEnum.DECREASE);
        plan.setLoadGoal(GoalDirectionEnum.DECREASE);

        String instructions = actorPromptDomainService.buildPrompt(plan, context("m")).getInstructions();

        assertTrue(instructions.contains("- Be relaxed and encouraging."));
        assertTrue(instructions.contains("- Simplify your explanation. Avoid complex terminology."));
    }

    @Test
    public void shouldRejectDuplicatedSectionHeader() {
        ActorPrompt prompt = new ActorPrompt();
        prompt.setInstructions("[Role Definition]\na\n[Current Situation]\nb\n[Strategy & Task]\nc\n[Constraints]\nd\n[Constraints]\ne");

        AppException ex = assertThrows(AppException.class, () -> actorPromptDomainService.validate(prompt));

        assertEquals(ResponseCode.PROMPT_VALIDATION_FAILED.getCode(), ex.getCode());
    }

    private DirectorPlan plan(String role, String beat) {
        DirectorPlan plan = new DirectorPlan();
        plan.setNextRole(role);
        plan.setNextBeat(beat);
        plan.setOutputAction(OutputActionEnum.ASK_SIMPLE_QUESTION);
        plan.setUserMustDo(new UserMustDo(UserMustDoTypeEnum.CHOICE, "从选项里选一个"));
        plan.setFlowMode(FlowModeEnum.RESCUE);
        plan.setIntent(IntentEnum.CONTINUE);
        plan.setUserMindState(List.of(MindStateEnum.PARTIAL));
        plan.setTalkBurstLimitSec(15);
        plan.setTensionGoal(GoalDirectionEnum.KEEP);
        plan.setLoadGoal(GoalDirectionEnum.KEEP);
        return plan;
    }

    private ActorSessionContext context(String metaphor) {
        return ActorSessionContext.builder()
                .sessionId("S1")
                .turnId("turn-1")
                .mainObjective("机会成本")
                .metaphor(metaphor)
                .lastUserText("我觉得是花的钱")
                .build();
    }
}
