package io.github.casevault.api.dto;

import jakarta.validation.constraints.NotNull;

public class UpdateUserRequest {

    @NotNull private Boolean active;

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }
}
