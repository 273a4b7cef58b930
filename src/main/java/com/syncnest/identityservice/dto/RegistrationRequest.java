package com.syncnest.identityservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.syncnest.identityservice.Validators.PasswordMatch;
import com.syncnest.identityservice.Validators.PasswordPolicy;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@PasswordMatch(passwordField = "password", passwordConfirmationField = "passwordConfirm")
@PasswordPolicy(passwordField = "password", emailField = "email", usernameField = "username")
public class RegistrationRequest {

    @NotBlank(message = "Email cannot be empty")
    @Email(message = "Email is not valid")
    @Size(max = 254, message = "Email must be at most 254 characters")
    private String email;

    @NotBlank(message = "Username cannot be empty")
    @Size(min = 3, max = 150, message = "Username must be between 3 and 150 characters")
    @Pattern(regexp = "^[\\w.@+-]+$", message = "Username may contain letters, digits and @/./+/-/_ only")
    private String username;

    @NotBlank(message = "Password cannot be empty")
    @Size(max = 128, message = "Password must be at most 128 characters")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @NotBlank(message = "Password confirmation is required")
    @JsonAlias("password_confirm")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String passwordConfirm;
}
