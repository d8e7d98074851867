package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionState {
    APPROVED("approved", "Execute the approved action automatically"),
    REJECTED("rejected", "Reject the action and notify stakeholders"),
    ESCALATED("escalated", "Escalate to the security/operations team"),
    PENDING_HUMAN_APPROVAL("pending_human_approval", "Await human review and approval"),
    MONITORING("monitoring", "Monitor the situation and wait for new data"),
    INVESTIGATING("investigating", "Investigate and collect more information");

    private final String wireName;
    private final String recommendedAction;

    DecisionState(String wireName, String recommendedAction) {
        this.wireName          = wireName;
        this.recommendedAction = recommendedAction;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String recommendedAction() {
        return recommendedAction;
    }

    /** States that can only be resolved by an operator. */
    public boolean awaitsHuman() {
        return this == PENDING_HUMAN_APPROVAL || this == INVESTIGATING;
    }
}
