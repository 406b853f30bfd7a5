package com.voicetutor.infrastructure.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * 大模型 JSON 输出的宽松解析。
 *
 * @author voicetutor
 * @since 2026-03-06
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 宽松读取模型输出：先整体解析，失败后截取第一个 '{' 到最后一个 '}' 再解析，仍失败返回 null。
     */
    public Map<String, Object> readEmbeddedMap(String content) {
        if (StringUtils.isBlank(content)) {
            return null;
        }
        Map<String, Object> payload = tryReadMap(content.trim());
        if (payload != null) {
            return payload;
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return tryReadMap(content.substring(start, end + 1));
        }
        return null;
    }

    private Map<String, Object> tryReadMap(String text) {
        try {
            return objectMapper.readValue(text, MAP_REF);
        } catch (IOException ex) {
            return null;
        }
    }
}
