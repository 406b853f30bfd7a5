package com.voicetutor.domain.actor.model.valobj;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 解析后的模板文档。
 *
 * @param rawLines 原始物理行
 * @param sections 按标题切分的段落
 */
public record PromptTemplateDocument(List<String> rawLines, List<TemplateSection> sections) {

    public PromptTemplateDocument {
        rawLines = rawLines == null ? new ArrayList<>() : List.copyOf(rawLines);
        sections = sections == null ? new ArrayList<>() : List.copyOf(sections);
    }

    /**
     * 第一个标题包含关键字的段落（不区分大小写）。
     */
    public Optional<TemplateSection> findSection(String keyword) {
        for (TemplateSection section : sections) {
            if (section.headingContains(keyword)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }

    /**
     * 前 maxLines 个物理行中的非空、非标题、非围栏行。
     */
    public List<String> leadingContentLines(int maxLines) {
        List<String> leading = new ArrayList<>();
        int limit = Math.min(maxLines, rawLines.size());
        for (int i = 0; i < limit; i++) {
            String trimmed = rawLines.get(i).trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#") && !trimmed.startsWith("```")) {
                leading.add(trimmed);
            }
        }
        return leading;
    }
}
