package com.example.file_server.util;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds storage names of the form {@code <yyyyMMddHHmmssSSS>_<16 hex>_<fragment>[.<ext>]}.
 *
 * <p>The time prefix makes names sort by upload time; the 64-bit random token keeps concurrent
 * uploads of the same original name apart. Only the extension and a short, filtered fragment of the
 * original base name survive.
 */
@Component
public class NameGenerator {
  public static final Pattern STORED_NAME =
      Pattern.compile("^\\d{17}_[0-9a-f]{16}_[A-Za-z0-9_-]{1,8}(\\.[a-z0-9]{1,16})?$");

  private static final DateTimeFormatter TIME_PREFIX =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);
  private static final Pattern EXTENSION = Pattern.compile("[a-z0-9]{1,16}");
  private static final int TOKEN_BYTES = 8;
  private static final int MAX_FRAGMENT_LENGTH = 8;
  private static final String DEFAULT_FRAGMENT = "file";

  private final Clock clock;
  private final SecureRandom random;

  @Autowired
  public NameGenerator() {
    this(Clock.systemUTC(), new SecureRandom());
  }

  public NameGenerator(Clock clock, SecureRandom random) {
    this.clock = clock;
    this.random = random;
  }

  public String generate(String originalName) {
    byte[] token = new byte[TOKEN_BYTES];
    random.nextBytes(token);

    StringBuilder name =
        new StringBuilder()
            .append(TIME_PREFIX.format(clock.instant()))
            .append('_')
            .append(HexFormat.of().formatHex(token))
            .append('_')
            .append(fragment(originalName));
    String extension = extension(originalName);
    if (!extension.isEmpty()) {
      name.append('.').append(extension);
    }
    return name.toString();
  }

  /** Lower-cased extension after the final dot, or empty if it is missing or not allow-listed. */
  public static String extension(String originalName) {
    String name = lastSegment(originalName);
    int dot = name.lastIndexOf('.');
    if (dot < 0) {
      return "";
    }
    String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
    return EXTENSION.matcher(ext).matches() ? ext : "";
  }

  static String fragment(String originalName) {
    String name = lastSegment(originalName);
    int dot = name.lastIndexOf('.');
    String base = dot < 0 ? name : name.substring(0, dot);
    StringBuilder clean = new StringBuilder(MAX_FRAGMENT_LENGTH);
    for (int i = 0; i < base.length() && clean.length() < MAX_FRAGMENT_LENGTH; i++) {
      char c = base.charAt(i);
      if ((c >= 'a' && c <= 'z')
          || (c >= 'A' && c <= 'Z')
          || (c >= '0' && c <= '9')
          || c == '-'
          || c == '_') {
        clean.append(c);
      }
    }
    return clean.length() == 0 ? DEFAULT_FRAGMENT : clean.toString();
  }

  // Client paths such as "C:\\Users\\me\\a.pdf" contribute only their last element.
  private static String lastSegment(String originalName) {
    if (originalName == null) {
      return "";
    }
    int cut = Math.max(originalName.lastIndexOf('/'), originalName.lastIndexOf('\\'));
    return originalName.substring(cut + 1);
  }
}
