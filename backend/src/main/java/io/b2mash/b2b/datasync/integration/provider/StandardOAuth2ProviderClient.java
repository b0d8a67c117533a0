package io.b2mash.b2b.datasync.integration.provider;

import io.b2mash.b2b.datasync.config.ProvidersProperties;
import io.b2mash.b2b.datasync.integration.ProviderType;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * RFC 6749 token endpoint calls (authorization code exchange, refresh, RFC 7009 revocation) over
 * {@link RestClient}. Concrete adapters supply account identity and {@link #fetchPage}.
 *
 * <p>Responses map onto the provider error taxonomy: 429, 5xx and I/O failures are transient; 401
 * and {@code invalid_grant} mean the credentials were rejected; any other 4xx and unparseable
 * bodies are permanent.
 */
public abstract class StandardOAuth2ProviderClient implements ProviderClient {

  private static final Logger log = LoggerFactory.getLogger(StandardOAuth2ProviderClient.class);

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
      new ParameterizedTypeReference<>() {};

  private final ProviderType provider;
  private final ProvidersProperties.Provider registration;
  protected final RestClient restClient;

  protected StandardOAuth2ProviderClient(
      ProviderType provider,
      ProvidersProperties.Provider registration,
      RestClient.Builder restClientBuilder) {
    this.provider = provider;
    this.registration = registration;
    this.restClient = restClientBuilder.build();
  }

  /** Identity of the connected account, resolved right after the code exchange. */
  public record AccountIdentity(String externalAccountId, String displayName) {}

  /**
   * Resolves who the freshly issued token belongs to. Some providers put it in the token response
   * (e.g. a {@code realmId}); others need a profile call with {@code accessToken}.
   */
  protected abstract AccountIdentity resolveAccount(
      String accessToken, Map<String, Object> tokenResponse);

  @Override
  public ProviderType provider() {
    return provider;
  }

  @Override
  public TokenGrant exchangeCode(String code, String redirectUri) {
    MultiValueMap<String, String> form = clientCredentialsForm();
    form.add("grant_type", "authorization_code");
    form.add("code", code);
    form.add("redirect_uri", redirectUri);

    Map<String, Object> body = postTokenEndpoint(form, "code exchange");
    String accessToken = requireString(body, "access_token");
    var account = resolveAccount(accessToken, body);
    if (account == null || account.externalAccountId() == null) {
      throw new ProviderPermanentException(
          provider.getSlug() + " code exchange: unable to resolve external account", null);
    }
    String tokenType = optionalString(body, "token_type");
    return new TokenGrant(
        accessToken,
        optionalString(body, "refresh_token"),
        tokenType != null ? tokenType : "Bearer",
        optionalLong(body, "expires_in"),
        parseScopes(body.get("scope")),
        account.externalAccountId(),
        account.displayName());
  }

  @Override
  public TokenRefreshResult refreshToken(String refreshToken) {
    MultiValueMap<String, String> form = clientCredentialsForm();
    form.add("grant_type", "refresh_token");
    form.add("refresh_token", refreshToken);

    Map<String, Object> body = postTokenEndpoint(form, "token refresh");
    return new TokenRefreshResult(
        requireString(body, "access_token"),
        optionalString(body, "refresh_token"),
        optionalLong(body, "expires_in"));
  }

  @Override
  public boolean supportsRevocation() {
    return registration.revocationUri() != null && !registration.revocationUri().isBlank();
  }

  @Override
  public void revoke(String token) {
    MultiValueMap<String, String> form = clientCredentialsForm();
    form.add("token", token);
    call(
        "token revocation",
        () ->
            restClient
                .post()
                .uri(registration.revocationUri())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .toBodilessEntity());
  }

  /**
   * Runs a provider request and translates Spring's client exceptions into {@link
   * ProviderException}s. Adapters wrap their {@code fetchPage} calls with it.
   */
  protected <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException e) {
      throw translate(operation, e);
    } catch (ResourceAccessException e) {
      throw new ProviderTransientException(
          provider.getSlug() + " " + operation + " failed: " + e.getMessage(), null, e);
    } catch (RestClientException e) {
      throw new ProviderPermanentException(
          provider.getSlug() + " " + operation + " returned an unreadable response", null, e);
    }
  }

  private ProviderException translate(String operation, RestClientResponseException e) {
    int status = e.getStatusCode().value();
    String message = provider.getSlug() + " " + operation + " failed with HTTP " + status;
    if (status == 429 || e.getStatusCode().is5xxServerError()) {
      return new ProviderTransientException(message, status, e);
    }
    if (status == 401 || isInvalidGrant(e)) {
      return new ProviderUnauthorizedException(message, status, e);
    }
    return new ProviderPermanentException(message, status, e);
  }

  private static boolean isInvalidGrant(RestClientResponseException e) {
    return e.getStatusCode().value() == 400
        && e.getResponseBodyAsString().contains("invalid_grant");
  }

  private Map<String, Object> postTokenEndpoint(MultiValueMap<String, String> form, String op) {
    Map<String, Object> body =
        call(
            op,
            () ->
                restClient
                    .post()
                    .uri(registration.tokenUri())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .body(JSON_OBJECT));
    if (body == null) {
      throw new ProviderPermanentException(provider.getSlug() + " " + op + ": empty body", null);
    }
    log.debug("{} {} succeeded", provider.getSlug(), op);
    return body;
  }

  private MultiValueMap<String, String> clientCredentialsForm() {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("client_id", registration.clientId());
    if (registration.clientSecret() != null) {
      form.add("client_secret", registration.clientSecret());
    }
    return form;
  }

  private String requireString(Map<String, Object> body, String key) {
    String value = optionalString(body, key);
    if (value == null || value.isBlank()) {
      throw new ProviderPermanentException(
          provider.getSlug() + " token response is missing " + key, null);
    }
    return value;
  }

  protected static String optionalString(Map<String, Object> body, String key) {
    Object value = body.get(key);
    return value != null ? value.toString() : null;
  }

  private Long optionalLong(Map<String, Object> body, String key) {
    Object value = body.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(value.toString());
    } catch (NumberFormatException e) {
      throw new ProviderPermanentException(
          provider.getSlug() + " token response has a non-numeric " + key, null, e);
    }
  }

  private List<String> parseScopes(Object raw) {
    if (raw == null) {
      return registration.scopes();
    }
    if (raw instanceof List<?> list) {
      return list.stream().map(Object::toString).toList();
    }
    String delimiter = registration.scopeDelimiter() != null ? registration.scopeDelimiter() : " ";
    return Arrays.stream(raw.toString().split(Pattern.quote(delimiter)))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
