package io.github.casevault.api.dto;

import jakarta.validation.constraints.NotBlank;

public class GrantAccessRequest {

    @NotBlank private String lawyerId;

    public String getLawyerId() {
        return lawyerId;
    }

    public void setLawyerId(String lawyerId) {
        this.lawyerId = lawyerId;
    }
}
