package com.albatross.adapter.in.web;

import com.albatross.application.port.in.LoginUseCase;
import com.albatross.application.port.in.RegisterUserUseCase;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.Result;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Auth", description = "Login and first-run bootstrap")
public class AuthController {

    private final LoginUseCase loginUseCase;
    private final RegisterUserUseCase registerUserUseCase;

    public AuthController(LoginUseCase loginUseCase, RegisterUserUseCase registerUserUseCase) {
        this.loginUseCase = loginUseCase;
        this.registerUserUseCase = registerUserUseCase;
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Verifies the password and returns a session token to send as a bearer token")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        Result<LoginUseCase.Session, CoreError> result = loginUseCase.login(request.username(), request.password());
        return result.isSuccess()
            ? ResponseEntity.ok(new LoginResponse(result.getOrThrow().apiKey(), result.getOrThrow().userId()))
            : ErrorResponses.from(result.errorOrNull());
    }

    @PostMapping("/bootstrap")
    @Operation(summary = "Create the first platform admin", description = "Only succeeds while no user exists")
    public ResponseEntity<?> bootstrap(@Valid @RequestBody BootstrapRequest request) {
        Result<String, CoreError> result =
            registerUserUseCase.bootstrapAdmin(request.username(), request.email(), request.password());
        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(new UserController.UserCreatedResponse(result.getOrThrow()))
            : ErrorResponses.from(result.errorOrNull());
    }

    public record LoginRequest(@NotBlank String username, @NotBlank String password) {}

    public record LoginResponse(
        @JsonProperty("api_key") String apiKey,
        @JsonProperty("user_id") String userId
    ) {}

    public record BootstrapRequest(@NotBlank String username, @NotBlank String email, @NotBlank String password) {}
}
