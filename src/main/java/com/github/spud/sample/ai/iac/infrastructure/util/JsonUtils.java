package com.github.spud.sample.ai.iac.infrastructure.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * Jackson 封装，解析失败统一抛出 {@link JsonParseException}
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  /**
   * 判断文本是否像一个 JSON 对象（只看首尾字符，不做完整解析）
   */
  public static boolean looksLikeJsonObject(String text) {
    if (text == null) {
      return false;
    }
    String trimmed = text.trim();
    return trimmed.startsWith("{") && trimmed.endsWith("}");
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return tryParse(() -> objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
    }), Exception.class);
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return tryParse(() -> objectMapper.readValue(json, new TypeReference<List<Object>>() {
    }), Exception.class);
  }
}
