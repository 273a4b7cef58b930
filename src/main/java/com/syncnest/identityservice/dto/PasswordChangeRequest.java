package com.syncnest.identityservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.syncnest.identityservice.Validators.PasswordMatch;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@PasswordMatch(passwordField = "newPassword", passwordConfirmationField = "newPasswordConfirm")
public class PasswordChangeRequest {

    @NotBlank(message = "oldPassword is required")
    @JsonAlias("old_password")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String oldPassword;

    @NotBlank(message = "newPassword is required")
    @Size(max = 128, message = "newPassword must be <= 128 characters")
    @JsonAlias("new_password")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String newPassword;

    @NotBlank(message = "newPasswordConfirm is required")
    @JsonAlias("new_password_confirm")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String newPasswordConfirm;
}
