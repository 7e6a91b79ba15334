package com.opspilot.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opspilot.types.enums.ResponseCode;
import com.opspilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * JSON 编解码工具。
 */
@Slf4j
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取 JSON 为 Map，格式错误时抛出 {@link AppException}。
     */
    public Map<String, Object> readMap(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, MAP_REF);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    /**
     * 从模型输出中读取 JSON 对象：先整体解析，失败时截取首个 '{' 到最后一个 '}' 再解析。
     *
     * @return 解析失败返回 null
     */
    public Map<String, Object> readObjectLeniently(String content) {
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

    /**
     * 写出为 JSON 字符串。
     */
    public String writeValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }

    private Map<String, Object> tryReadMap(String text) {
        try {
            return readMap(text);
        } catch (AppException ex) {
            log.debug("Failed to parse model json: {}", ex.getMessage());
            return null;
        }
    }
}
