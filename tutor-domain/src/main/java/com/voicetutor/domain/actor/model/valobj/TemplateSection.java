package com.voicetutor.domain.actor.model.valobj;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板中的一个段落：标题以及标题下直到下一个标题之前的内容。
 *
 * @param heading      标题文本，不含 # 前缀；文档开头无标题部分为 null
 * @param level        标题级别，无标题为 0
 * @param lines        段落正文行，不含围栏内的内容
 * @param fencedBlocks 段落内的围栏代码块内容
 */
public record TemplateSection(String heading, int level, List<String> lines, List<String> fencedBlocks) {

    public TemplateSection {
        lines = lines == null ? new ArrayList<>() : List.copyOf(lines);
        fencedBlocks = fencedBlocks == null ? new ArrayList<>() : List.copyOf(fencedBlocks);
    }

    /**
     * 非空正文行，已去除首尾空白。
     */
    public List<String> contentLines() {
        List<String> content = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                content.add(trimmed);
            }
        }
        return content;
    }

    public boolean headingContains(String keyword) {
        return heading != null && keyword != null && heading.toLowerCase().contains(keyword.toLowerCase());
    }
}
