package com.syncnest.identityservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogoutRequest {

    @NotBlank(message = "refreshToken is required")
    @Size(max = 2048, message = "refreshToken is too long")
    @JsonAlias({"refresh", "refresh_token"})
    private String refreshToken;
}
