package com.voicetutor.domain.director.model.valobj;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 导演决策调试信息。
 */
@Data
public class DirectorDebug {

    /** 决策来源：heuristic / delegated / fallback */
    private String source;
    private List<String> beatCandidates = new ArrayList<>();
    private String beatChoiceReason;
    private String roleChoiceReason;
    /** 被护栏改写的说明，未改写为空 */
    private List<String> guardrailNotes = new ArrayList<>();
    private String fallbackReason;

    public void addGuardrailNote(String note) {
        guardrailNotes.add(note);
    }

    public DirectorDebug copy() {
        DirectorDebug copy = new DirectorDebug();
        copy.setSource(source);
        copy.setBeatCandidates(new ArrayList<>(beatCandidates));
        copy.setBeatChoiceReason(beatChoiceReason);
        copy.setRoleChoiceReason(roleChoiceReason);
        copy.setGuardrailNotes(new ArrayList<>(guardrailNotes));
        copy.setFallbackReason(fallbackReason);
        return copy;
    }
}
