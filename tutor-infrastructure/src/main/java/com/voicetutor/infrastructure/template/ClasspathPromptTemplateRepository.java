package com.voicetutor.infrastructure.template;

import com.voicetutor.domain.actor.adapter.repository.IPromptTemplateRepository;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 从 {location}/roles/*.md 与 {location}/beats/*.md 加载模板，文件名即角色/节拍名。
 * <p>
 * 启动时一次性加载。单个文件读取失败只记录告警；一个模板都没有加载到时构造失败。
 * </p>
 */
@Slf4j
public class ClasspathPromptTemplateRepository implements IPromptTemplateRepository {

    private static final String TEMPLATE_SUFFIX = ".md";

    private final Map<String, String> roleTemplates;
    private final Map<String, String> beatTemplates;

    public ClasspathPromptTemplateRepository(ResourcePatternResolver resolver, String location) {
        String base = StringUtils.removeEnd(StringUtils.defaultIfBlank(location, "classpath:prompts"), "/");
        this.roleTemplates = Collections.unmodifiableMap(load(resolver, base + "/roles/*" + TEMPLATE_SUFFIX));
        this.beatTemplates = Collections.unmodifiableMap(load(resolver, base + "/beats/*" + TEMPLATE_SUFFIX));
        if (roleTemplates.isEmpty() && beatTemplates.isEmpty()) {
            throw new AppException(ResponseCode.TEMPLATE_NOT_FOUND, "No prompt templates found under " + base);
        }
        if (roleTemplates.isEmpty() || beatTemplates.isEmpty()) {
            log.warn("PROMPT_TEMPLATES_PARTIAL location={}, roles={}, beats={}", base, roleTemplates.size(), beatTemplates.size());
        }
        log.info("PROMPT_TEMPLATES_LOADED location={}, roles={}, beats={}", base, roleTemplates.keySet(), beatTemplates.keySet());
    }

    @Override
    public String findRoleTemplate(String role) {
        return role == null ? null : roleTemplates.get(role);
    }

    @Override
    public String findBeatTemplate(String beat) {
        return beat == null ? null : beatTemplates.get(beat);
    }

    @Override
    public Set<String> roleNames() {
        return roleTemplates.keySet();
    }

    @Override
    public Set<String> beatNames() {
        return beatTemplates.keySet();
    }

    private Map<String, String> load(ResourcePatternResolver resolver, String pattern) {
        Map<String, String> templates = new TreeMap<>();
        Resource[] resources;
        try {
            resources = resolver.getResources(pattern);
        } catch (IOException ex) {
            log.warn("PROMPT_TEMPLATES_SCAN_FAILED pattern={}, error={}", pattern, ex.getMessage());
            return templates;
        }
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null || !filename.endsWith(TEMPLATE_SUFFIX)) {
                continue;
            }
            String name = filename.substring(0, filename.length() - TEMPLATE_SUFFIX.length());
            try (InputStream input = resource.getInputStream()) {
                templates.put(name, StreamUtils.copyToString(input, StandardCharsets.UTF_8));
            } catch (IOException ex) {
                log.warn("PROMPT_TEMPLATE_READ_FAILED pattern={}, name={}, error={}", pattern, name, ex.getMessage());
            }
        }
        return templates;
    }
}
