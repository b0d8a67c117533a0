package io.b2mash.b2b.datasync.integration.oauth;

import io.b2mash.b2b.datasync.integration.ProviderType;
import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import io.b2mash.b2b.datasync.security.Roles;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OAuthController {

  private final OAuthHandshakeService handshakeService;

  public OAuthController(OAuthHandshakeService handshakeService) {
    this.handshakeService = handshakeService;
  }

  @PostMapping("/api/integrations/{provider}/connect")
  @PreAuthorize(Roles.MANAGE_INTEGRATIONS)
  public ResponseEntity<ConnectResponse> connect(
      @PathVariable ProviderType provider,
      @Valid @RequestBody(required = false) ConnectRequest request) {
    var start =
        handshakeService.beginHandshake(
            RequestScopes.requireTenantId(),
            RequestScopes.requireUserId(),
            provider,
            request != null ? request.redirectAfter() : null);
    return ResponseEntity.ok(new ConnectResponse(start.authorizationUrl(), start.expiresAt()));
  }

  /** Unauthenticated: the browser arrives here from the provider, the state token authorizes it. */
  @GetMapping("/api/integrations/{provider}/callback")
  public ResponseEntity<CallbackResponse> callback(
      @PathVariable ProviderType provider,
      @RequestParam(required = false) String state,
      @RequestParam(required = false) String code,
      @RequestParam(required = false) String error) {
    var result = handshakeService.handleCallback(provider, state, code, error);
    return ResponseEntity.ok(
        new CallbackResponse(result.integration().getId(), "connected", result.redirectTo()));
  }

  public record ConnectRequest(@Size(max = 500) String redirectAfter) {}

  public record ConnectResponse(String authorizationUrl, Instant expiresAt) {}

  public record CallbackResponse(UUID integrationId, String status, String redirectTo) {}
}
