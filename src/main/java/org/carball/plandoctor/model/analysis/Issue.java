package org.carball.plandoctor.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A performance anti-pattern detected in a plan.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Issue {
    IssueType type;
    String description;
    Severity severity;
    /** Display label of the operator that triggered the issue, if any. */
    String relatedNode;
    String suggestedFix;
}
