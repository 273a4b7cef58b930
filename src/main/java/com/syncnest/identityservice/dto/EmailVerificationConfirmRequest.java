package com.syncnest.identityservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailVerificationConfirmRequest {

    @NotBlank(message = "token is required")
    @Size(max = 128, message = "token is too long")
    private String token;

    @NotNull(message = "userId is required")
    @JsonAlias({"user_id", "uid"})
    private UUID userId;
}
