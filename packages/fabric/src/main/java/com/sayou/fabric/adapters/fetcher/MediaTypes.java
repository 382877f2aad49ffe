package com.sayou.fabric.adapters.fetcher;

import java.util.Locale;

/** Media type helpers shared by the fetchers. */
final class MediaTypes {
  private MediaTypes() {}

  /** Guess from the file extension; {@code text/plain} when unknown. */
  static String fromFileName(String fileName) {
    String name = fileName.toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    String ext = dot < 0 ? "" : name.substring(dot + 1);
    return switch (ext) {
      case "html", "htm", "xhtml" -> "text/html";
      case "json" -> "application/json";
      case "md", "markdown" -> "text/markdown";
      case "xml" -> "application/xml";
      case "csv" -> "text/csv";
      default -> "text/plain";
    };
  }

  /** {@code text/html; charset=utf-8} becomes {@code text/html}. */
  static String strip(String contentType) {
    if (contentType == null) return null;
    int semicolon = contentType.indexOf(';');
    String type = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
    return type.trim().toLowerCase(Locale.ROOT);
  }
}
