package io.b2mash.b2b.datasync.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for the OAuth authorization-code handshake.
 *
 * @param stateTtl lifetime of a CSRF state token before it is rejected as expired
 * @param stateRetention how long consumed or expired states are kept before garbage collection
 * @param callbackBaseUrl public base URL the provider redirects back to
 * @param defaultRedirect post-connect redirect used when the caller supplies none
 * @param invalidatePreviousStates when true, starting a handshake consumes the tenant's other live
 *     states for the same provider
 */
@ConfigurationProperties(prefix = "datasync.oauth")
public record OAuthProperties(
    @DefaultValue("10m") Duration stateTtl,
    @DefaultValue("1d") Duration stateRetention,
    @DefaultValue("http://localhost:8080") String callbackBaseUrl,
    @DefaultValue("/integrations") String defaultRedirect,
    @DefaultValue("false") boolean invalidatePreviousStates) {}
