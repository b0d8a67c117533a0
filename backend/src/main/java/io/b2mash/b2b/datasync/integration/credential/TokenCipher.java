package io.b2mash.b2b.datasync.integration.credential;

import io.b2mash.b2b.datasync.config.CredentialProperties;
import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM encryption of OAuth tokens. Each value gets a fresh 96-bit IV and is stored as
 * {@code v{keyVersion}:{base64 iv}:{base64 ciphertext}}, so values written under an older key
 * version are recognisable after a key rotation. Retired keys decrypt values of their own version
 * only; new values always use the current key.
 */
@Component
public class TokenCipher {

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final int IV_LENGTH = 12; // bytes (96 bits)

  private final SecretKeySpec encryptionKey;
  private final int keyVersion;
  private final Map<Integer, SecretKeySpec> retiredKeys = new HashMap<>();
  private final SecureRandom secureRandom = new SecureRandom();

  public TokenCipher(CredentialProperties properties) {
    this.keyVersion = properties.keyVersion();
    String encodedKey = properties.encryptionKey();
    if (encodedKey == null || encodedKey.isBlank()) {
      this.encryptionKey = null; // fails in validateKey()
    } else {
      this.encryptionKey = new SecretKeySpec(decodeKey(encodedKey), "AES");
    }
    properties
        .retiredKeys()
        .forEach(
            (version, encoded) ->
                retiredKeys.put(version, new SecretKeySpec(decodeKey(encoded), "AES")));
  }

  @PostConstruct
  void validateKey() {
    if (encryptionKey == null) {
      throw new IllegalStateException(
          "datasync.credentials.encryption-key is not set. "
              + "Cannot start without an encryption key for stored credentials.");
    }
    if (encryptionKey.getEncoded().length != 32) {
      throw new IllegalStateException(
          "datasync.credentials.encryption-key must be a Base64-encoded 256-bit (32-byte) key. "
              + "Got "
              + encryptionKey.getEncoded().length
              + " bytes.");
    }
    if (retiredKeys.containsKey(keyVersion)) {
      throw new IllegalStateException(
          "datasync.credentials.retired-keys must not contain the current key version "
              + keyVersion);
    }
    retiredKeys.forEach(
        (version, key) -> {
          if (key.getEncoded().length != 32) {
            throw new IllegalStateException(
                "Retired encryption key version " + version + " is not a 256-bit key");
          }
        });
  }

  public String encrypt(String plaintext) {
    if (plaintext == null) {
      return null;
    }
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return "v"
          + keyVersion
          + ":"
          + Base64.getEncoder().encodeToString(iv)
          + ":"
          + Base64.getEncoder().encodeToString(ciphertext);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Token encryption failed", e);
    }
  }

  public String decrypt(String stored) {
    if (stored == null) {
      return null;
    }
    String[] parts = stored.split(":", 3);
    if (parts.length != 3 || !parts[0].startsWith("v")) {
      throw new IllegalStateException("Stored token is not in the v{n}:{iv}:{ciphertext} format");
    }
    int storedVersion = parseVersion(parts[0]);
    SecretKeySpec key =
        storedVersion == keyVersion ? encryptionKey : retiredKeys.get(storedVersion);
    if (key == null) {
      throw new IllegalStateException(
          "Stored token was encrypted with key version "
              + storedVersion
              + ", which is neither the current version "
              + keyVersion
              + " nor a retired key");
    }
    try {
      byte[] iv = Base64.getDecoder().decode(parts[1]);
      byte[] ciphertext = Base64.getDecoder().decode(parts[2]);
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new IllegalStateException("Token decryption failed", e);
    }
  }

  public int getKeyVersion() {
    return keyVersion;
  }

  private static int parseVersion(String prefix) {
    try {
      return Integer.parseInt(prefix.substring(1));
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Stored token has an invalid key version: " + prefix, e);
    }
  }

  private static byte[] decodeKey(String encodedKey) {
    try {
      return Base64.getDecoder().decode(encodedKey.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Encryption key is not valid Base64", e);
    }
  }
}
