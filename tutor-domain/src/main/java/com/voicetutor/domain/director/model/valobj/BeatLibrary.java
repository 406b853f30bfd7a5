package com.voicetutor.domain.director.model.valobj;

import com.voicetutor.types.enums.OutputActionEnum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内置节拍库。
 */
public final class BeatLibrary {

    public static final String REVEAL = "reveal";
    public static final String CHECK = "check";
    public static final String DEEPEN = "deepen";
    public static final String TWIST = "twist";
    public static final String CONTINUE = "continue";
    public static final String LENS_SHIFT = "lens_shift";
    public static final String FEYNMAN = "feynman";
    public static final String MONTAGE = "montage";
    public static final String MINIGAME = "minigame";
    public static final String EXIT_TICKET = "exit_ticket";

    private static final Map<String, BeatCard> CARDS;

    static {
        Map<String, BeatCard> cards = new LinkedHashMap<>();
        register(cards, new BeatCard(REVEAL, "用简单比喻解释核心概念，降维打击", "复述理解", 20,
                "用户能用自己的话复述比喻", List.of(CHECK, LENS_SHIFT), OutputActionEnum.EXPLAIN_WITH_METAPHOR));
        register(cards, new BeatCard(CHECK, "快速检验用户理解，逼出输出", "回答问题", 15,
                "用户给出明确答案", List.of(DEEPEN, TWIST, CONTINUE), OutputActionEnum.ASK_SIMPLE_QUESTION));
        register(cards, new BeatCard(DEEPEN, "深入机制链，引导更深层理解", "阐述推理", 25,
                "用户能解释因果关系", List.of(CHECK, FEYNMAN), OutputActionEnum.ASK_ELABORATION));
        register(cards, new BeatCard(TWIST, "用反例打破错觉，戳破误解", "重新思考", 20,
                "用户意识到矛盾", List.of(REVEAL, CHECK), OutputActionEnum.CHALLENGE_ASSUMPTION));
        register(cards, new BeatCard(CONTINUE, "保持叙事惯性，小步推进", "跟随思路", 20,
                "自然过渡到下一话题", List.of(CHECK, DEEPEN), OutputActionEnum.ACKNOWLEDGE_AND_CONTINUE));
        register(cards, new BeatCard(LENS_SHIFT, "换视角重新解释，澄清边界", "对比理解", 25,
                "用户能区分不同视角", List.of(CHECK, DEEPEN), OutputActionEnum.REFRAME_PERSPECTIVE));
        register(cards, new BeatCard(FEYNMAN, "让用户讲给别人听，巩固理解", "教别人", 30,
                "用户能清晰地教给假想对象", List.of(MONTAGE, EXIT_TICKET), OutputActionEnum.ASK_TEACH_BACK));
        register(cards, new BeatCard(MONTAGE, "快速切换多个场景，展示迁移", "识别模式", 30,
                "用户能识别跨场景的共同模式", List.of(EXIT_TICKET), OutputActionEnum.SHOW_MULTIPLE_EXAMPLES));
        register(cards, new BeatCard(MINIGAME, "通过互动游戏降低负荷，恢复能量", "参与互动", 20,
                "用户完成互动任务", List.of(CONTINUE, EXIT_TICKET), OutputActionEnum.ENGAGE_INTERACTIVE));
        register(cards, new BeatCard(EXIT_TICKET, "最终测评，检验迁移能力", "迁移应用", 15,
                "用户完成测评题", List.of(), OutputActionEnum.ASSESS_TRANSFER));
        CARDS = Collections.unmodifiableMap(cards);
    }

    private BeatLibrary() {
    }

    private static void register(Map<String, BeatCard> cards, BeatCard card) {
        cards.put(card.beatId(), card);
    }

    public static List<String> defaultBeats() {
        return new ArrayList<>(CARDS.keySet());
    }

    public static BeatCard find(String beatId) {
        return beatId == null ? null : CARDS.get(beatId);
    }

    /**
     * 节拍对应的输出动作，未登记的节拍返回 continue_dialogue。
     */
    public static OutputActionEnum outputActionOf(String beatId) {
        BeatCard card = find(beatId);
        return card == null ? OutputActionEnum.CONTINUE_DIALOGUE : card.outputAction();
    }
}
