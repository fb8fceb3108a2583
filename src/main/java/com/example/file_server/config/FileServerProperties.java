package com.example.file_server.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Binds the {@code file-server.*} properties into one immutable value, constructed once at startup
 * and handed to each component through its constructor.
 *
 * <p>Extensions are normalized to lower case without a leading dot. A blank {@code uploadPassword}
 * disables every password-gated operation.
 */
@Validated
@ConfigurationProperties(prefix = "file-server")
public record FileServerProperties(
    String uploadPassword,
    @NotBlank String storageDir,
    @NotBlank @DefaultValue("http://localhost:8008") String baseUrl,
    @Positive @DefaultValue("524288000") long maxFileSize,
    @Positive @DefaultValue("255") int maxFilenameLength,
    @DefaultValue({}) Set<String> blockedExtensions,
    @DefaultValue({}) Set<String> allowedExtensions,
    @DefaultValue({}) Set<String> blockedContentTypes,
    @DefaultValue("true") boolean publicRead,
    @DefaultValue("dev") String version) {

  public FileServerProperties {
    baseUrl = stripTrailingSlashes(baseUrl);
    blockedExtensions = normalizeExtensions(blockedExtensions);
    allowedExtensions = normalizeExtensions(allowedExtensions);
    blockedContentTypes =
        blockedContentTypes == null
            ? Set.of()
            : blockedContentTypes.stream()
                .map(type -> type.trim().toLowerCase(Locale.ROOT))
                .filter(type -> !type.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
  }

  /** Absolute, normalized storage root. */
  public Path storageRoot() {
    return Path.of(storageDir).toAbsolutePath().normalize();
  }

  private static String stripTrailingSlashes(String url) {
    if (url == null) {
      return null;
    }
    String trimmed = url.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }

  private static Set<String> normalizeExtensions(Set<String> extensions) {
    if (extensions == null) {
      return Set.of();
    }
    return extensions.stream()
        .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
        .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
        .filter(ext -> !ext.isEmpty())
        .collect(Collectors.toUnmodifiableSet());
  }
}
