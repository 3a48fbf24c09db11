package org.carball.plandoctor.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.plandoctor.model.plan.PlanNode;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the output of {@code EXPLAIN (ANALYZE, FORMAT JSON)} into a {@link QueryPlan}.
 * <p>
 * Input that cannot be interpreted never raises; it yields {@link QueryPlan#empty()}.
 */
@Slf4j
public class PlanParser {

    private static final String PLAN = "Plan";
    private static final String PLANS = "Plans";
    private static final String EXECUTION_TIME = "Execution Time";
    private static final String PLANNING_TIME = "Planning Time";

    private static final Set<String> NODE_FIELDS = Set.of(
            "Node Type", "Relation Name", "Startup Cost", "Total Cost", "Plan Rows", "Plan Width",
            "Actual Startup Time", "Actual Total Time", "Actual Rows", "Actual Loops", PLANS
    );

    private final ObjectMapper objectMapper;

    public PlanParser() {
        this(new ObjectMapper());
    }

    public PlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a raw plan given as a {@link JsonNode}, a JSON string, or a Map/List object graph.
     */
    public QueryPlan parse(Object rawPlan) {
        JsonNode root = toTree(rawPlan);
        if (root == null) {
            return QueryPlan.empty();
        }

        JsonNode planData = root;
        if (root.isArray()) {
            planData = root.size() > 0 ? root.get(0) : null;
        }

        if (planData == null || !planData.isObject() || planData.isEmpty()) {
            log.debug("Raw plan has no interpretable content, returning empty plan");
            return QueryPlan.empty();
        }

        QueryPlan.QueryPlanBuilder builder = QueryPlan.builder()
                .executionTime(timing(planData, EXECUTION_TIME, "Execution"))
                .planningTime(timing(planData, PLANNING_TIME, "Planning"))
                .plan(parseNode(planData.get(PLAN)))
                .query(text(planData, "Query Text", "Query"));

        JsonNode triggers = planData.get("Triggers");
        if (triggers != null && triggers.isArray()) {
            for (JsonNode trigger : triggers) {
                if (trigger.isObject()) {
                    builder.trigger(toMap(trigger));
                }
            }
        }

        JsonNode warnings = planData.get("Warnings");
        if (warnings != null && warnings.isArray()) {
            for (JsonNode warning : warnings) {
                if (!warning.isNull()) {
                    builder.warning(warning.asText());
                }
            }
        }

        return builder.build();
    }

    private JsonNode toTree(Object rawPlan) {
        if (rawPlan == null) {
            return null;
        }
        if (rawPlan instanceof JsonNode) {
            return (JsonNode) rawPlan;
        }
        if (rawPlan instanceof String) {
            String text = ((String) rawPlan).trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                log.warn("Plan text is not valid JSON, returning empty plan: {}", e.getOriginalMessage());
                return null;
            }
        }
        try {
            return objectMapper.valueToTree(rawPlan);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot interpret plan of type {}, returning empty plan", rawPlan.getClass().getName());
            return null;
        }
    }

    PlanNode parseNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return PlanNode.unknown();
        }

        PlanNode.PlanNodeBuilder builder = PlanNode.builder()
                .relation(text(node, "Relation Name"))
                .startupCost(decimal(node, "Startup Cost"))
                .totalCost(decimal(node, "Total Cost"))
                .planRows(integer(node, "Plan Rows"))
                .planWidth(integer(node, "Plan Width"))
                .actualStartupTime(decimal(node, "Actual Startup Time"))
                .actualTotalTime(decimal(node, "Actual Total Time"))
                .actualRows(integer(node, "Actual Rows"))
                .actualLoops(integer(node, "Actual Loops"));

        String nodeType = text(node, "Node Type");
        if (nodeType != null) {
            builder.nodeType(nodeType);
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!NODE_FIELDS.contains(field.getKey()) && !field.getValue().isNull()) {
                builder.attribute(toAttributeKey(field.getKey()), toValue(field.getValue()));
            }
        }

        JsonNode children = node.get(PLANS);
        if (children != null && children.isArray()) {
            for (JsonNode child : children) {
                builder.child(parseNode(child));
            }
        }

        return builder.build();
    }

    /**
     * Converts an engine key such as {@code "Sort Space Used"} to {@code "sortSpaceUsed"}.
     */
    static String toAttributeKey(String key) {
        String[] words = key.trim().split("\\s+");
        StringBuilder camel = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (camel.length() == 0) {
                camel.append(Character.toLowerCase(word.charAt(0))).append(word.substring(1));
            } else {
                camel.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return camel.toString();
    }

    private static double timing(JsonNode planData, String key, String section) {
        JsonNode value = planData.get(key);
        if (value == null || !value.isNumber()) {
            JsonNode nested = planData.get(section);
            value = nested != null && nested.isObject() ? nested.get(key) : null;
        }
        return value != null && value.isNumber() ? value.asDouble() : 0;
    }

    private static String text(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isValueNode() && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Double decimal(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    private static Long integer(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value != null && value.isNumber() ? value.asLong() : null;
    }

    /**
     * Copies a JSON object into an unmodifiable map that keeps the engine's key order.
     */
    private static Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> map = new LinkedHashMap<>();
        node.fields().forEachRemaining(field -> map.put(field.getKey(), toValue(field.getValue())));
        return Collections.unmodifiableMap(map);
    }

    private static Object toValue(JsonNode value) {
        if (value.isObject()) {
            return toMap(value);
        }
        if (value.isArray()) {
            List<Object> items = new ArrayList<>();
            value.forEach(item -> items.add(toValue(item)));
            return Collections.unmodifiableList(items);
        }
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
