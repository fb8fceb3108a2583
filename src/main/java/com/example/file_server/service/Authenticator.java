package com.example.file_server.service;

import com.example.file_server.config.FileServerProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Checks a submitted password against the configured upload password.
 *
 * <p>Both sides are reduced to SHA-256 digests and compared with {@link MessageDigest#isEqual}, so
 * the time taken does not depend on the secret's length or on where the first difference occurs.
 * Without a configured password every check fails, but still hashes and compares against a random
 * digest so the two rejection paths do the same work.
 */
@Component
public class Authenticator {
  private static final Logger log = LoggerFactory.getLogger(Authenticator.class);
  private static final String HASH_ALGO = "SHA-256";

  private final byte[] expectedDigest;
  private final boolean configured;

  @Autowired
  public Authenticator(FileServerProperties properties) {
    this(properties.uploadPassword());
  }

  public Authenticator(String secret) {
    this.configured = secret != null && !secret.isBlank();
    if (configured) {
      this.expectedDigest = digest(secret);
    } else {
      byte[] filler = new byte[32];
      new SecureRandom().nextBytes(filler);
      this.expectedDigest = digest(new String(filler, StandardCharsets.ISO_8859_1));
      log.warn(
          "No upload password configured; upload, list and delete requests will be rejected.");
    }
  }

  public boolean verify(String submittedSecret) {
    byte[] submitted = digest(submittedSecret == null ? "" : submittedSecret);
    boolean matches = MessageDigest.isEqual(expectedDigest, submitted);
    return configured && matches && submittedSecret != null && !submittedSecret.isEmpty();
  }

  private static byte[] digest(String value) {
    try {
      return MessageDigest.getInstance(HASH_ALGO).digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      // every JRE ships SHA-256
      throw new IllegalStateException(HASH_ALGO + " not available", e);
    }
  }
}
