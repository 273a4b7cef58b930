package com.syncnest.identityservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.syncnest.identityservice.Validators.PasswordMatch;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@PasswordMatch(passwordField = "newPassword", passwordConfirmationField = "newPasswordConfirm")
public class PasswordResetConfirmRequest {

    @NotBlank(message = "token is required")
    @Size(max = 128, message = "token is too long")
    private String token;

    @NotNull(message = "userId is required")
    @JsonAlias({"user_id", "uid"})
    private UUID userId;

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
