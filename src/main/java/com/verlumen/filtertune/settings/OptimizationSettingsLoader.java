package com.verlumen.filtertune.settings;

import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Loads and saves {@link OptimizationSettings} as JSON.
 *
 * <p>Loaded documents are merged over the bundled defaults: nested objects merge key by key, and
 * any other value replaces the default. Keys the defaults lack are kept.
 */
public final class OptimizationSettingsLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String DEFAULT_SETTINGS_RESOURCE = "/filtertune/default-settings.json";

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private OptimizationSettingsLoader() {}

  /** Returns the bundled default settings. */
  public static OptimizationSettings defaults() {
    return GSON.fromJson(defaultDocument(), OptimizationSettings.class);
  }

  /** Parses a JSON document and merges it over the defaults. */
  public static OptimizationSettings parseJson(String jsonContent) {
    return GSON.fromJson(
        merge(defaultDocument(), parseObject(jsonContent)), OptimizationSettings.class);
  }

  /**
   * Loads settings from a file. A missing file yields the defaults.
   *
   * @throws OptimizationSettingsException if the file cannot be read or is not a JSON object
   */
  public static OptimizationSettings load(Path path) {
    if (!Files.exists(path)) {
      logger.atWarning().log("Settings file %s not found, using defaults", path);
      return defaults();
    }
    String content;
    try {
      content = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      logger.atSevere().withCause(e).log("Failed to read settings from %s", path);
      throw new OptimizationSettingsException("Failed to read settings from: " + path, e);
    }
    OptimizationSettings settings = parseJson(content);
    logger.atInfo().log("Settings loaded from %s", path);
    return settings;
  }

  /** Loads settings from a classpath resource and merges them over the defaults. */
  public static OptimizationSettings loadResource(String resourcePath) {
    return GSON.fromJson(
        merge(defaultDocument(), readResource(resourcePath)), OptimizationSettings.class);
  }

  public static String toJson(OptimizationSettings settings) {
    return GSON.toJson(settings);
  }

  /** Stamps {@code settings} with the current time and writes it to {@code path}. */
  public static void save(OptimizationSettings settings, Path path) {
    settings.setLastModified(LocalDateTime.now().toString());
    try {
      Files.writeString(path, toJson(settings), StandardCharsets.UTF_8);
    } catch (IOException e) {
      logger.atSevere().withCause(e).log("Failed to save settings to %s", path);
      throw new OptimizationSettingsException("Failed to save settings to: " + path, e);
    }
    logger.atInfo().log("Settings saved to %s", path);
  }

  private static JsonObject defaultDocument() {
    return readResource(DEFAULT_SETTINGS_RESOURCE);
  }

  private static JsonObject readResource(String resourcePath) {
    String normalizedPath = resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
    InputStream is = OptimizationSettingsLoader.class.getResourceAsStream(normalizedPath);
    if (is == null) {
      throw new OptimizationSettingsException("Resource not found: " + resourcePath);
    }
    try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
      return asObject(JsonParser.parseReader(reader), resourcePath);
    } catch (IOException | JsonParseException e) {
      throw new OptimizationSettingsException(
          "Failed to load settings from resource: " + resourcePath, e);
    }
  }

  private static JsonObject parseObject(String jsonContent) {
    try {
      return asObject(JsonParser.parseString(jsonContent), "JSON content");
    } catch (JsonParseException e) {
      throw new OptimizationSettingsException("Malformed settings JSON", e);
    }
  }

  private static JsonObject asObject(JsonElement element, String source) {
    if (!element.isJsonObject()) {
      throw new OptimizationSettingsException("Settings must be a JSON object: " + source);
    }
    return element.getAsJsonObject();
  }

  /** Merges {@code overrides} into {@code base} and returns {@code base}. */
  static JsonObject merge(JsonObject base, JsonObject overrides) {
    for (Map.Entry<String, JsonElement> entry : overrides.entrySet()) {
      JsonElement current = base.get(entry.getKey());
      JsonElement override = entry.getValue();
      if (current != null && current.isJsonObject() && override.isJsonObject()) {
        merge(current.getAsJsonObject(), override.getAsJsonObject());
      } else {
        base.add(entry.getKey(), override);
      }
    }
    return base;
  }
}
