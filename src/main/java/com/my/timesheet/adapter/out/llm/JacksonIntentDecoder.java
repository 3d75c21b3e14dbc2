package com.my.timesheet.adapter.out.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.timesheet.domain.model.Intent;
import com.my.timesheet.domain.model.IntentBlock;
import com.my.timesheet.domain.model.IntentDateRange;
import com.my.timesheet.domain.port.out.IntentPayloadDecoder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: LLM 응답 원문에서 의도 JSON을 관대하게 읽어 도메인 Intent로 옮기기 위함.
 *
 * <p>schedule은 schedule/schedule_blocks/scheduleBlocks, 블록 경계는 from/start_time, to/end_time 키를 모두 허용한다.
 */
@ApplicationScoped
public class JacksonIntentDecoder implements IntentPayloadDecoder {

    private static final Logger log = Logger.getLogger(JacksonIntentDecoder.class);
    private static final Pattern OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    @Inject
    public JacksonIntentDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Intent> decode(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> root = readObject(text);
        if (root.isEmpty()) {
            Matcher matcher = OBJECT.matcher(text);
            if (matcher.find()) {
                root = readObject(matcher.group());
            }
        }
        return root.map(this::toIntent);
    }

    private Optional<JsonNode> readObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debugf("의도 JSON 해석 실패: %s", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Intent toIntent(JsonNode root) {
        JsonNode schedule = first(root, "schedule", "schedule_blocks", "scheduleBlocks");
        return new Intent(
                text(root, "intent"),
                dateRange(root.get("date_range")),
                blocks(schedule),
                blocks(root.get("breaks")),
                text(root, "project"),
                text(root, "task"),
                text(root, "description"),
                text(root, "location"),
                text(root, "notes"),
                strings(root.get("missing_fields")));
    }

    private static IntentDateRange dateRange(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode count = node.get("count");
        Integer countValue = count == null || count.isNull() ? null : count.asInt(0);
        return new IntentDateRange(
                text(node, "type"),
                text(node, "from"),
                text(node, "to"),
                text(node, "value"),
                countValue);
    }

    private static List<IntentBlock> blocks(JsonNode node) {
        List<IntentBlock> blocks = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return blocks;
        }
        for (JsonNode block : node) {
            if (!block.isObject()) {
                continue;
            }
            String from = text(block, "from");
            String to = text(block, "to");
            blocks.add(new IntentBlock(
                    from != null ? from : text(block, "start_time"),
                    to != null ? to : text(block, "end_time")));
        }
        return blocks;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        node.forEach(value -> {
            if (!value.isNull()) {
                values.add(value.asText());
            }
        });
        return values;
    }

    private static JsonNode first(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode node = root.get(name);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
