package com.cadastral.lookup.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequestDto {

    @JsonProperty("email")
    @NotBlank(message = "Email is required")
    @Email(message = "Email must be a valid address")
    @Size(max = 320)
    private String email;

    @JsonProperty("password")
    @NotBlank(message = "Password is required")
    @Size(min = 3, max = 128, message = "Password must be between 3 and 128 characters")
    private String password;
}
