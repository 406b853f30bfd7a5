package com.voicetutor.domain.actor.service;

import com.voicetutor.domain.actor.adapter.repository.IPromptTemplateRepository;
import com.voicetutor.domain.actor.model.valobj.ActorPrompt;
import com.voicetutor.domain.actor.model.valobj.ActorPromptDebug;
import com.voicetutor.domain.actor.model.valobj.ActorSessionContext;
import com.voicetutor.domain.actor.model.valobj.ActorSettings;
import com.voicetutor.domain.actor.model.valobj.PromptSection;
import com.voicetutor.domain.actor.model.valobj.PromptTemplateDocument;
import com.voicetutor.domain.actor.model.valobj.TemplateSection;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.types.enums.GoalDirectionEnum;
import com.voicetutor.types.enums.MindStateEnum;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 角色指令领域服务：角色精髓 + 节拍指引 + 固定段落，组装后校验，失败时给出确定性的兜底指令。
 */
@Slf4j
public class ActorPromptDomainService {

    public static final String SECTION_ROLE = "[Role Definition]";
    public static final String SECTION_SITUATION = "[Current Situation]";
    public static final String SECTION_STRATEGY = "[Strategy & Task]";
    public static final String SECTION_CONSTRAINTS = "[Constraints]";
    public static final List<String> REQUIRED_SECTIONS = List.of(
            SECTION_ROLE, SECTION_SITUATION, SECTION_STRATEGY, SECTION_CONSTRAINTS);

    private static final String PROFILE_SECTION = "Profile";
    private static final String PROMPT_TEMPLATE_SECTION = "Prompt Template";
    private static final int FALLBACK_OBJECTIVE_MAX_LENGTH = 200;

    private final IPromptTemplateRepository promptTemplateRepository;
    private final PromptTemplateParser parser;
    private final ActorSettings settings;

    public ActorPromptDomainService(IPromptTemplateRepository promptTemplateRepository,
                                    PromptTemplateParser parser,
                                    ActorSettings settings) {
        this.promptTemplateRepository = promptTemplateRepository;
        this.parser = parser;
        this.settings = settings == null ? ActorSettings.defaults() : settings;
    }

    /**
     * 查模板、组装、校验；任何校验类失败都降级为兜底指令，不向调用方抛出。
     */
    public ActorPrompt buildPrompt(DirectorPlan plan, ActorSessionContext context) {
        try {
            String roleTemplate = plan == null ? null : promptTemplateRepository.findRoleTemplate(plan.getNextRole());
            String beatTemplate = plan == null ? null : promptTemplateRepository.findBeatTemplate(plan.getNextBeat());
            return assemble(plan, context, roleTemplate, beatTemplate);
        } catch (AppException ex) {
            log.warn("ACTOR_PROMPT_FALLBACK sessionId={}, turnId={}, code={}, reason={}",
                    context == null ? null : context.getSessionId(),
                    context == null ? null : context.getTurnId(),
                    ex.getCode(),
                    ex.getInfo());
            return fallbackPrompt(plan, context, ex.getInfo());
        }
    }

    public ActorPrompt assemble(DirectorPlan plan,
                                ActorSessionContext context,
                                String roleTemplate,
                                String beatTemplate) {
        if (plan == null || !plan.isActionable()) {
            throw new AppException(ResponseCode.EMPTY_INSTRUCTION, "Director plan has no actionable instruction");
        }
        if (StringUtils.isBlank(plan.getNextRole())) {
            throw new AppException(ResponseCode.EMPTY_INSTRUCTION, "Director plan has no role");
        }
        if (roleTemplate == null) {
            throw new AppException(ResponseCode.TEMPLATE_NOT_FOUND, "Role template not found: " + plan.getNextRole());
        }
        if (beatTemplate == null) {
            throw new AppException(ResponseCode.TEMPLATE_NOT_FOUND, "Beat template not found: " + plan.getNextBeat());
        }
        ActorSessionContext safeContext = context == null ? new ActorSessionContext() : context;
        ActorPromptDebug debug = newDebug(plan, safeContext);

        String roleEssence = extractRoleEssence(parser.parse(roleTemplate), debug);
        String beatGuidance = extractBeatGuidance(parser.parse(beatTemplate), plan, safeContext, debug);

        List<PromptSection> sections = new ArrayList<>();
        sections.add(new PromptSection(SECTION_ROLE, buildRoleSection(plan, roleEssence)));
        sections.add(new PromptSection(SECTION_SITUATION, buildSituationSection(plan, safeContext)));
        sections.add(new PromptSection(SECTION_STRATEGY, buildStrategySection(plan, beatGuidance)));
        sections.add(new PromptSection(SECTION_CONSTRAINTS, buildConstraintSection(plan)));

        ActorPrompt prompt = render(sections, debug);
        validate(prompt);
        return prompt;
    }

    /**
     * 每个必需段落标题恰好出现一次，总长度不超过上限。
     */
    public void validate(ActorPrompt prompt) {
        String instructions = prompt == null ? null : prompt.getInstructions();
        if (StringUtils.isBlank(instructions)) {
            throw new AppException(ResponseCode.PROMPT_VALIDATION_FAILED, "Instructions are empty");
        }
        for (String header : REQUIRED_SECTIONS) {
            int count = StringUtils.countMatches(instructions, header);
            if (count != 1) {
                throw new AppException(ResponseCode.PROMPT_VALIDATION_FAILED,
                        "Section " + header + " appears " + count + " times");
            }
        }
        if (instructions.length() > settings.getMaxPromptLength()) {
            throw new AppException(ResponseCode.PROMPT_VALIDATION_FAILED,
                    "Instructions length " + instructions.length() + " exceeds " + settings.getMaxPromptLength());
        }
    }

    /**
     * 兜底指令：只引用学习目标与通用时长限制。
     */
    public ActorPrompt fallbackPrompt(DirectorPlan plan, ActorSessionContext context, String reason) {
        ActorSessionContext safeContext = context == null ? new ActorSessionContext() : context;
        String objective = sanitizeObjective(safeContext.getMainObjective());
        int limit = settings.getFallbackTalkBurstLimitSec();

        List<PromptSection> sections = new ArrayList<>();
        sections.add(new PromptSection(SECTION_ROLE, "You are a friendly tutor guiding the learner."));
        sections.add(new PromptSection(SECTION_SITUATION, "Learning Objective: " + objective));
        sections.add(new PromptSection(SECTION_STRATEGY,
                "Briefly recap the key idea of the objective, then ask the learner to restate it in one sentence."));
        sections.add(new PromptSection(SECTION_CONSTRAINTS, String.join("\n",
                "- Keep your turn under " + limit + " seconds of speech.",
                "- Use short, spoken sentences.",
                "- End with a question for the learner.")));

        ActorPromptDebug debug = newDebug(plan, safeContext);
        debug.setFallback(true);
        debug.setFallbackReason(reason);
        debug.setTalkBurstLimitSec(limit);
        return render(sections, debug);
    }

    private ActorPrompt render(List<PromptSection> sections, ActorPromptDebug debug) {
        String instructions = sections.stream().map(PromptSection::render).collect(Collectors.joining("\n\n"));
        debug.setLength(instructions.length());
        ActorPrompt prompt = new ActorPrompt();
        prompt.setSections(sections);
        prompt.setInstructions(instructions);
        prompt.setDebug(debug);
        return prompt;
    }

    private String extractRoleEssence(PromptTemplateDocument document, ActorPromptDebug debug) {
        Optional<TemplateSection> profile = document.findSection(PROFILE_SECTION);
        if (profile.isPresent() && !profile.get().contentLines().isEmpty()) {
            debug.setRoleEssenceSource("profile");
            return String.join("\n", profile.get().contentLines());
        }
        debug.setRoleEssenceSource("leading_lines");
        return String.join("\n", document.leadingContentLines(settings.getProfileFallbackLines()));
    }

    private String extractBeatGuidance(PromptTemplateDocument document,
                                       DirectorPlan plan,
                                       ActorSessionContext context,
                                       ActorPromptDebug debug) {
        Optional<TemplateSection> section = document.findSection(PROMPT_TEMPLATE_SECTION);
        if (section.isPresent() && !section.get().fencedBlocks().isEmpty()) {
            String block = String.join("\n", section.get().fencedBlocks()).trim();
            if (StringUtils.isNotBlank(block)) {
                debug.setBeatGuidanceSource("fenced_block");
                return block
                        .replace("{concept}", StringUtils.defaultString(context.getMainObjective()))
                        .replace("{metaphor}", StringUtils.defaultIfBlank(context.getMetaphor(), settings.getDefaultMetaphor()));
            }
        }
        debug.setBeatGuidanceSource("synthesized");
        return String.format("Execute the '%s' strategy.\nAction: %s", plan.getNextBeat(), plan.getOutputAction().getCode());
    }

    private String buildRoleSection(DirectorPlan plan, String roleEssence) {
        StringBuilder builder = new StringBuilder();
        builder.append("You are ").append(plan.getNextRole()).append('.');
        if (StringUtils.isNotBlank(roleEssence)) {
            builder.append('\n').append(roleEssence);
        }
        return builder.toString();
    }

    private String buildSituationSection(DirectorPlan plan, ActorSessionContext context) {
        StringBuilder builder = new StringBuilder();
        builder.append("- Learning Objective: ").append(StringUtils.defaultIfBlank(context.getMainObjective(), "N/A")).append('\n');
        builder.append("- User Mind State: ").append(formatMindStates(plan.getUserMindState())).append('\n');
        builder.append("- Intent: ").append(plan.getIntent() == null ? "N/A" : plan.getIntent().getCode()).append('\n');
        builder.append("- Flow Mode: ").append(plan.getFlowMode() == null ? "N/A" : plan.getFlowMode().name()).append('\n');
        builder.append("- Last User Input: \"").append(StringUtils.defaultString(context.getLastUserText())).append('"');
        if (StringUtils.isNotBlank(context.getPendingQuestion())) {
            builder.append("\n- Pending Branch Question: ").append(context.getPendingQuestion());
        }
        return builder.toString();
    }

    private String buildStrategySection(DirectorPlan plan, String beatGuidance) {
        StringBuilder builder = new StringBuilder();
        builder.append("- Beat: ").append(plan.getNextBeat()).append('\n');
        builder.append("- Output Action: ").append(plan.getOutputAction().getCode()).append('\n');
        builder.append(beatGuidance);
        if (plan.getUserMustDo() != null && plan.getUserMustDo().getType() != null) {
            builder.append("\n- The learner must: ").append(plan.getUserMustDo().getType().getCode())
                    .append(" (").append(StringUtils.defaultString(plan.getUserMustDo().getPrompt())).append(')');
        }
        return builder.toString();
    }

    private String buildConstraintSection(DirectorPlan plan) {
        List<String> rules = new ArrayList<>();
        rules.add("- Keep your turn under " + plan.getTalkBurstLimitSec() + " seconds of speech.");
        rules.add("- Use short, spoken sentences.");
        rules.add("- End with a question or prompt that invites the learner to respond.");
        rules.add("- Keep a conversational tone.");
        if (plan.getTensionGoal() == GoalDirectionEnum.DECREASE) {
            rules.add("- Be relaxed and encouraging.");
        }
        if (plan.getLoadGoal() == GoalDirectionEnum.DECREASE) {
            rules.add("- Simplify your explanation. Avoid complex terminology.");
        }
        return String.join("\n", rules);
    }

    private ActorPromptDebug newDebug(DirectorPlan plan, ActorSessionContext context) {
        ActorPromptDebug debug = new ActorPromptDebug();
        debug.setSessionId(context.getSessionId());
        debug.setTurnId(context.getTurnId());
        if (plan != null) {
            debug.setRole(plan.getNextRole());
            debug.setBeat(plan.getNextBeat());
            debug.setOutputAction(plan.getOutputAction() == null ? null : plan.getOutputAction().getCode());
            debug.setTalkBurstLimitSec(plan.getTalkBurstLimitSec());
            if (plan.getUserMindState() != null) {
                debug.setUserMindState(plan.getUserMindState().stream().map(MindStateEnum::getCode).collect(Collectors.toList()));
            }
        }
        return debug;
    }

    private String formatMindStates(List<MindStateEnum> mindStates) {
        if (mindStates == null || mindStates.isEmpty()) {
            return "N/A";
        }
        return mindStates.stream().map(MindStateEnum::getCode).collect(Collectors.joining(", "));
    }

    private String sanitizeObjective(String objective) {
        String value = StringUtils.defaultIfBlank(objective, "the current topic");
        value = value.replace("[", "").replace("]", "");
        return StringUtils.abbreviate(value, FALLBACK_OBJECTIVE_MAX_LENGTH);
    }
}
