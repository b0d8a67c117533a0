package io.b2mash.b2b.datasync.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Keys for encrypting stored OAuth tokens.
 *
 * @param encryptionKey Base64-encoded 256-bit key used for new values
 * @param keyVersion version stamped on values encrypted with {@code encryptionKey}
 * @param retiredKeys earlier keys by version, kept so values written before a rotation stay
 *     readable until they are rewritten
 */
@ConfigurationProperties(prefix = "datasync.credentials")
public record CredentialProperties(
    String encryptionKey, @DefaultValue("1") int keyVersion, Map<Integer, String> retiredKeys) {

  public CredentialProperties {
    retiredKeys = retiredKeys != null ? Map.copyOf(retiredKeys) : Map.of();
  }
}
