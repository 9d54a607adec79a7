package dev.reviewflow.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.reviewflow.domain.enums.DecisionType;
import dev.reviewflow.domain.valueobject.Decision;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DecisionRequest(DecisionType decision, String comment) {

    public Decision toDecision() {
        return new Decision(decision, comment);
    }
}
