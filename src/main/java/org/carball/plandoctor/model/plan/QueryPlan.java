package org.carball.plandoctor.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A captured execution plan: the operator tree plus whole-statement timings.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryPlan {

    /** Milliseconds. */
    double executionTime;

    /** Milliseconds. */
    double planningTime;

    @Builder.Default
    PlanNode plan = PlanNode.unknown();

    @Singular
    List<Map<String, Object>> triggers;

    @Singular
    List<String> warnings;

    String query;

    /**
     * Never null: a plan built without a root reads as {@link PlanNode#unknown()}.
     */
    public PlanNode getPlan() {
        return plan != null ? plan : PlanNode.unknown();
    }

    /**
     * The plan returned when the raw input could not be interpreted.
     */
    public static QueryPlan empty() {
        return QueryPlan.builder().build();
    }
}
