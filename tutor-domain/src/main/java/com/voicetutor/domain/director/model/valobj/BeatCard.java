package com.voicetutor.domain.director.model.valobj;

import com.voicetutor.types.enums.OutputActionEnum;

import java.util.List;

/**
 * 节拍卡片：节拍的目标、学习者动作、时长提示、退出条件与后续建议。
 */
public record BeatCard(String beatId,
                       String goal,
                       String userMustDoHint,
                       int talkBurstLimitHint,
                       String exitCondition,
                       List<String> nextSuggest,
                       OutputActionEnum outputAction) {
}
