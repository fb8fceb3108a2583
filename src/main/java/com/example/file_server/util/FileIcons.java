package com.example.file_server.util;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Emoji shown next to a file in listings, keyed by extension. */
public final class FileIcons {
  public static final String DEFAULT_ICON = "📎";

  private static final Map<String, String> ICONS = new HashMap<>();

  static {
    register("🖼️", List.of("jpg", "jpeg", "png", "gif", "webp", "svg", "bmp", "ico"));
    register("🎬", List.of("mp4", "webm", "avi", "mov", "mkv", "flv", "wmv"));
    register("🎵", List.of("mp3", "wav", "ogg", "flac", "aac", "m4a"));
    register("📄", List.of("pdf", "doc", "docx", "txt", "md", "rtf"));
    register("📊", List.of("xls", "xlsx", "csv", "ods"));
    register("📽️", List.of("ppt", "pptx", "odp"));
    register("📦", List.of("zip", "tar", "gz", "bz2", "rar", "7z"));
    register("🌐", List.of("html"));
    register("🎨", List.of("css"));
    register("⚡", List.of("js", "ts"));
    register("🐍", List.of("py"));
    register("☕", List.of("java"));
    register("🐹", List.of("go"));
    register("🦀", List.of("rs"));
    register("🔧", List.of("cpp", "c", "h"));
    register("📋", List.of("json", "xml", "yaml", "yml"));
  }

  private FileIcons() {}

  private static void register(String icon, List<String> extensions) {
    extensions.forEach(ext -> ICONS.put(ext, icon));
  }

  public static String forName(String filename) {
    return ICONS.getOrDefault(NameGenerator.extension(filename), DEFAULT_ICON);
  }
}
