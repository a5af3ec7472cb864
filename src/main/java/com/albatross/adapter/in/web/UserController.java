package com.albatross.adapter.in.web;

import com.albatross.application.port.in.ChangePasswordUseCase;
import com.albatross.application.port.in.ManageApiKeysUseCase;
import com.albatross.application.port.in.QueryReadModelsUseCase;
import com.albatross.application.port.in.RegisterUserUseCase;
import com.albatross.application.port.out.ApiKeyReadModel.ApiKeyView;
import com.albatross.application.port.out.UserReadModel.UserView;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.Result;
import com.albatross.domain.model.Role;
import com.albatross.infrastructure.context.RequestContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/users")
@Tag(name = "Users", description = "User registration, passwords and API keys")
public class UserController {

    private final RegisterUserUseCase registerUserUseCase;
    private final ChangePasswordUseCase changePasswordUseCase;
    private final ManageApiKeysUseCase manageApiKeysUseCase;
    private final QueryReadModelsUseCase queryReadModelsUseCase;

    public UserController(
            RegisterUserUseCase registerUserUseCase,
            ChangePasswordUseCase changePasswordUseCase,
            ManageApiKeysUseCase manageApiKeysUseCase,
            QueryReadModelsUseCase queryReadModelsUseCase) {
        this.registerUserUseCase = registerUserUseCase;
        this.changePasswordUseCase = changePasswordUseCase;
        this.manageApiKeysUseCase = manageApiKeysUseCase;
        this.queryReadModelsUseCase = queryReadModelsUseCase;
    }

    @PostMapping
    @Operation(summary = "Register a user", description = "Tenant admins register users of their own tenant; platform admins anyone")
    public ResponseEntity<?> registerUser(@Valid @RequestBody RegisterUserRequest request) {
        Optional<Role> role = Role.parse(request.role());
        if (role.isEmpty()) {
            return ErrorResponses.from(new CoreError.Validation("Unknown role: " + request.role()));
        }
        Result<String, CoreError> result = registerUserUseCase.registerUser(
            RequestContext.getUser(), request.username(), request.email(), request.password(), role.get(), request.tenantId());
        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(new UserCreatedResponse(result.getOrThrow()))
            : ErrorResponses.from(result.errorOrNull());
    }

    @GetMapping
    @Operation(summary = "List users", description = "Scoped by role: all users, the caller's tenant, or the caller only")
    public ResponseEntity<?> listUsers() {
        Result<List<UserView>, CoreError> result = queryReadModelsUseCase.listUsers(RequestContext.getUser());
        return result.isSuccess()
            ? ResponseEntity.ok(ListResponse.of(result.getOrThrow().stream().map(UserResponse::from).toList()))
            : ErrorResponses.from(result.errorOrNull());
    }

    @PutMapping("/{userId}/password")
    @Operation(summary = "Change a user's password")
    public ResponseEntity<?> changePassword(
            @Parameter(description = "User ID") @PathVariable String userId,
            @Valid @RequestBody ChangePasswordRequest request) {
        Result<Void, CoreError> result =
            changePasswordUseCase.changePassword(RequestContext.getUser(), userId, request.newPassword());
        return result.isSuccess()
            ? ResponseEntity.noContent().build()
            : ErrorResponses.from(result.errorOrNull());
    }

    @PostMapping("/{userId}/apikeys")
    @Operation(summary = "Generate an API key", description = "The secret is returned once and cannot be retrieved again")
    public ResponseEntity<?> generateApiKey(
            @Parameter(description = "User ID") @PathVariable String userId,
            @Valid @RequestBody GenerateApiKeyRequest request) {
        Result<ManageApiKeysUseCase.GeneratedApiKey, CoreError> result =
            manageApiKeysUseCase.generateApiKey(RequestContext.getUser(), userId, request.keyName());
        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(ApiKeyCreatedResponse.from(result.getOrThrow()))
            : ErrorResponses.from(result.errorOrNull());
    }

    @GetMapping("/{userId}/apikeys")
    @Operation(summary = "List a user's API keys", description = "Key metadata only, never secrets or hashes")
    public ResponseEntity<?> listApiKeys(@Parameter(description = "User ID") @PathVariable String userId) {
        Result<List<ApiKeyView>, CoreError> result =
            queryReadModelsUseCase.listApiKeys(RequestContext.getUser(), userId);
        return result.isSuccess()
            ? ResponseEntity.ok(ListResponse.of(result.getOrThrow().stream().map(ApiKeyResponse::from).toList()))
            : ErrorResponses.from(result.errorOrNull());
    }

    @DeleteMapping("/{userId}/apikeys/{keyId}")
    @Operation(summary = "Revoke an API key")
    public ResponseEntity<?> revokeApiKey(
            @Parameter(description = "User ID") @PathVariable String userId,
            @Parameter(description = "Key ID", example = "key_0190f1c2-7d43-7a1e-9f5e-3c1f2b9a8d77") @PathVariable String keyId) {
        Result<Void, CoreError> result = manageApiKeysUseCase.revokeApiKey(RequestContext.getUser(), userId, keyId);
        return result.isSuccess()
            ? ResponseEntity.noContent().build()
            : ErrorResponses.from(result.errorOrNull());
    }

    public record RegisterUserRequest(
        @NotBlank String username,
        @NotBlank String email,
        @NotBlank String password,
        @NotBlank String role,
        @JsonProperty("tenant_id") String tenantId
    ) {}

    public record ChangePasswordRequest(@JsonProperty("new_password") @NotBlank String newPassword) {}

    public record GenerateApiKeyRequest(@JsonProperty("key_name") @NotBlank String keyName) {}

    public record UserCreatedResponse(@JsonProperty("user_id") String userId) {}

    public record ApiKeyCreatedResponse(
        @JsonProperty("key_id") String keyId,
        @JsonProperty("api_key") String apiKey
    ) {
        public static ApiKeyCreatedResponse from(ManageApiKeysUseCase.GeneratedApiKey key) {
            return new ApiKeyCreatedResponse(key.keyId(), key.apiKey());
        }
    }

    public record UserResponse(
        @JsonProperty("user_id") String userId,
        @JsonProperty("tenant_id") String tenantId,
        String username,
        String email,
        String role,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("last_login_at") Instant lastLoginAt
    ) {
        public static UserResponse from(UserView user) {
            return new UserResponse(
                user.userId(), user.tenantId(), user.username(), user.email(),
                user.role().label(), user.createdAt(), user.lastLoginAt());
        }
    }

    public record ApiKeyResponse(
        @JsonProperty("key_id") String keyId,
        @JsonProperty("key_name") String keyName,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("revoked_at") Instant revokedAt
    ) {
        public static ApiKeyResponse from(ApiKeyView key) {
            return new ApiKeyResponse(key.keyId(), key.keyName(), key.createdAt(), key.revokedAt());
        }
    }
}
