package com.voicetutor.domain.actor.service;

import com.voicetutor.domain.actor.model.valobj.PromptTemplateDocument;
import com.voicetutor.domain.actor.model.valobj.TemplateSection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown 模板解析器：按标题切分段落，收集段落内的围栏代码块。
 * <p>
 * 围栏内以 # 开头的行不视为标题。未闭合的围栏收到文档末尾。
 * </p>
 */
@Component
public class PromptTemplateParser {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*?)\\s*#*\\s*$");
    private static final String FENCE = "```";

    public PromptTemplateDocument parse(String markdown) {
        List<String> rawLines = new ArrayList<>();
        List<TemplateSection> sections = new ArrayList<>();
        if (markdown == null || markdown.isEmpty()) {
            return new PromptTemplateDocument(rawLines, sections);
        }

        SectionBuilder current = new SectionBuilder(null, 0);
        StringBuilder fenced = null;
        for (String line : markdown.split("\\r?\\n", -1)) {
            rawLines.add(line);
            String trimmed = line.trim();
            if (trimmed.startsWith(FENCE)) {
                if (fenced == null) {
                    fenced = new StringBuilder();
                } else {
                    current.fencedBlocks.add(stripTrailingNewline(fenced));
                    fenced = null;
                }
                continue;
            }
            if (fenced != null) {
                fenced.append(line).append('\n');
                continue;
            }
            Matcher matcher = HEADING.matcher(trimmed);
            if (matcher.matches()) {
                current.addTo(sections);
                current = new SectionBuilder(matcher.group(2), matcher.group(1).length());
                continue;
            }
            current.lines.add(line);
        }
        if (fenced != null) {
            current.fencedBlocks.add(stripTrailingNewline(fenced));
        }
        current.addTo(sections);
        return new PromptTemplateDocument(rawLines, sections);
    }

    private String stripTrailingNewline(StringBuilder builder) {
        int length = builder.length();
        if (length > 0 && builder.charAt(length - 1) == '\n') {
            return builder.substring(0, length - 1);
        }
        return builder.toString();
    }

    private static final class SectionBuilder {
        private final String heading;
        private final int level;
        private final List<String> lines = new ArrayList<>();
        private final List<String> fencedBlocks = new ArrayList<>();

        private SectionBuilder(String heading, int level) {
            this.heading = heading;
            this.level = level;
        }

        private void addTo(List<TemplateSection> sections) {
            // 文档开头没有内容时不生成空的无标题段
            if (heading == null && lines.stream().allMatch(String::isBlank) && fencedBlocks.isEmpty()) {
                return;
            }
            sections.add(new TemplateSection(heading, level, lines, fencedBlocks));
        }
    }
}
