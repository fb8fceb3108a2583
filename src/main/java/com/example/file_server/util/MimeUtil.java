package com.example.file_server.util;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.tika.Tika;
import org.apache.tika.io.LookaheadInputStream;

public final class MimeUtil {
  public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private static final Tika tika = new Tika();
  private static final int LOOKAHEAD = 64 * 1024; // 64 KB

  private MimeUtil() {}

  /**
   * Buffers the raw InputStream, lets Tika sniff up to LOOKAHEAD bytes through a
   * LookaheadInputStream, then hands back the buffered stream positioned at the first byte along
   * with the detected type. {@code nameHint} may be null.
   */
  public static Detected detect(InputStream raw, String nameHint) throws IOException {
    BufferedInputStream buffered = new BufferedInputStream(raw, LOOKAHEAD);
    String type;
    // closing the lookahead resets the buffered stream, it does not close it
    try (InputStream lookahead = new LookaheadInputStream(buffered, LOOKAHEAD)) {
      type = tika.detect(lookahead, nameHint);
    }
    return new Detected(buffered, type == null || type.isBlank() ? DEFAULT_CONTENT_TYPE : type);
  }

  /** Type guessed from the file name alone, for entries that are listed rather than uploaded. */
  public static String detectFromName(String name) {
    String type = tika.detect(name);
    return type == null || type.isBlank() ? DEFAULT_CONTENT_TYPE : type;
  }

  public static class Detected {
    public final InputStream stream; // positioned at start
    public final String contentType;

    public Detected(InputStream s, String ct) {
      this.stream = s;
      this.contentType = ct;
    }
  }
}
