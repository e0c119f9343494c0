package io.github.casevault.api.dto;

import io.github.casevault.model.CaseCategory;
import io.github.casevault.model.CaseStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/** Partial case update. Null fields are left unchanged. */
public class UpdateCaseRequest {

    @Size(max = 255)
    private String title;

    @Size(max = 10000) private String description;
    private CaseCategory category;
    private CaseStatus status;

    @Min(1)
    @Max(5)
    private Integer priority;

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public CaseCategory getCategory() {
        return category;
    }

    public void setCategory(CaseCategory category) {
        this.category = category;
    }

    public CaseStatus getStatus() {
        return status;
    }

    public void setStatus(CaseStatus status) {
        this.status = status;
    }

    public Integer getPriority() {
        return priority;
    }

    public void setPriority(Integer priority) {
        this.priority = priority;
    }

    public boolean isEmpty() {
        return title == null
                && description == null
                && category == null
                && status == null
                && priority == null;
    }
}
