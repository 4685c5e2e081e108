package com.eainde.chesscoach.lesson;

import com.eainde.chesscoach.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.List;

/**
 * Reads the model's final answer into lesson comments.
 * <p>
 * Models wrap JSON in markdown fences, add prose around it and leave trailing commas; all of
 * that is tolerated. Anything still unreadable is reported as a {@link ValidationException}
 * whose message can be shown to the model.
 */
public final class LessonPayloadParser {

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private LessonPayloadParser() {
    }

    public static List<LessonComment> parse(String text) {
        String json = extractJson(text);
        try {
            Payload payload = LENIENT_MAPPER.readValue(json, Payload.class);
            if (payload.comments() == null) {
                throw new ValidationException("Lesson JSON must contain a 'comments' array");
            }
            return payload.comments();
        } catch (JsonProcessingException e) {
            throw new ValidationException("Lesson JSON could not be read: " + rootCauseMessage(e), e);
        }
    }

    /** Strips markdown fences and surrounding prose, keeping the outermost JSON object. */
    static String extractJson(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Final answer is empty; expected a JSON object with a 'comments' array");
        }
        String cleaned = text.strip();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline < 0 ? "" : cleaned.substring(firstNewline + 1);
            int fence = cleaned.lastIndexOf("```");
            if (fence >= 0) {
                cleaned = cleaned.substring(0, fence);
            }
        }
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new ValidationException("Final answer contains no JSON object; expected {\"comments\": [...]}");
        }
        return cleaned.substring(start, end + 1);
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : cause.getMessage();
        return message != null && message.length() > 200 ? message.substring(0, 200) + "..." : message;
    }

    record Payload(List<LessonComment> comments) {
    }
}
