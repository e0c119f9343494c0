package io.github.casevault.api.dto;

import io.github.casevault.model.ReviewDecision;
import jakarta.validation.constraints.NotNull;

public class ReviewAccessRequest {

    @NotNull private ReviewDecision decision;

    public ReviewDecision getDecision() {
        return decision;
    }

    public void setDecision(ReviewDecision decision) {
        this.decision = decision;
    }
}
