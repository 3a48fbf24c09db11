package org.carball.plandoctor.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One operator of an execution plan, with its estimated and measured statistics.
 * <p>
 * Statistics are boxed so that a field the engine did not report stays {@code null}
 * instead of reading as zero. Engine-specific keys that have no dedicated field are kept
 * in {@link #getAttributes()} under their camelCase name (e.g. {@code sortMethod}).
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanNode {

    public static final String UNKNOWN_TYPE = "Unknown";

    @Builder.Default
    String nodeType = UNKNOWN_TYPE;
    String relation;
    Double startupCost;
    Double totalCost;
    Long planRows;
    Long planWidth;
    Double actualStartupTime;
    Double actualTotalTime;
    Long actualRows;
    Long actualLoops;

    @Singular("child")
    List<PlanNode> children;

    @Singular("attribute")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    Map<String, Object> attributes;

    /**
     * Never null: a node built without a type reads as {@value #UNKNOWN_TYPE}.
     */
    public String getNodeType() {
        return nodeType != null ? nodeType : UNKNOWN_TYPE;
    }

    public static PlanNode unknown() {
        return PlanNode.builder().build();
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    /**
     * Returns the attribute as text, or null when it is absent.
     */
    public String attributeText(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }

    public boolean hasRelation() {
        return relation != null && !relation.isEmpty();
    }
}
