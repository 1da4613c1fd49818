package com.ayios.fflags.integrations;

import com.ayios.fflags.integrations.FileFlagStoreBuilder.SourceInfo;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagRecord;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.launchdarkly.sdk.LDValue;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

abstract class FileFlagStoreParsing {
  private FileFlagStoreParsing() {}

  /**
   * Indicates that the file store encountered an error in one of the input files. It is converted
   * to an {@link IOException} before it leaves the store.
   */
  @SuppressWarnings("serial")
  static final class FileDataException extends Exception {
    private final SourceInfo source;

    public FileDataException(String message, Throwable cause, SourceInfo source) {
      super(message, cause);
      this.source = source;
    }

    public FileDataException(String message, Throwable cause) {
      this(message, cause, null);
    }

    FileDataException withSource(SourceInfo source) {
      return this.source != null ? this : new FileDataException(getMessage(), getCause(), source);
    }

    public String getDescription() {
      StringBuilder s = new StringBuilder();
      if (getMessage() != null) {
        s.append(getMessage());
      }
      if (getCause() != null) {
        s.append(" [").append(getCause().toString()).append("]");
      }
      if (source != null) {
        s.append(": ").append(source.toString());
      }
      return s.toString();
    }
  }

  /**
   * The basic data structure that we expect all source files to contain.
   */
  static final class FlagFileRep {
    List<FlagRecordRep> flags;

    FlagFileRep() {}
  }

  /**
   * One flag record as it appears in a file, before validation.
   */
  static final class FlagRecordRep {
    @SerializedName(value = "_id", alternate = { "id" })
    String id;
    String type;
    LDValue value;
    String createdAt;
    LDValue env;
    LDValue tags;
    String description;
    LDValue attributes;

    FlagRecordRep() {}

    FlagRecord toRecord() throws FileDataException {
      if (id == null || id.isEmpty()) {
        throw new FileDataException("flag record has no id", null);
      }
      FlagKind kind = FlagKind.fromTag(type);
      if (kind == null) {
        throw new FileDataException("flag \"" + id + "\" has unknown type \"" + type + "\"", null);
      }
      Instant created = null;
      if (createdAt != null) {
        try {
          created = Instant.parse(createdAt);
        } catch (DateTimeParseException e) {
          throw new FileDataException("flag \"" + id + "\" has invalid createdAt", e);
        }
      }
      return FlagRecord.builder(id, kind)
          .value(value)
          .createdAt(created)
          .env(env)
          .tags(tags)
          .description(description)
          .attributes(attributes)
          .build();
    }
  }

  static abstract class FlagFileParser {
    private static final FlagFileParser jsonParser = new JsonFlagFileParser();
    private static final FlagFileParser yamlParser = new YamlFlagFileParser();

    public abstract FlagFileRep parse(InputStream input) throws FileDataException, IOException;

    public static FlagFileParser selectForContent(byte[] data) {
      Reader r = new InputStreamReader(new ByteArrayInputStream(data), StandardCharsets.UTF_8);
      return detectJson(r) ? jsonParser : yamlParser;
    }

    private static boolean detectJson(Reader r) {
      // A valid JSON file for our purposes must be an object, i.e. it must start with '{'
      while (true) {
        try {
          int ch = r.read();
          if (ch < 0) {
            return false;
          }
          if (ch == '{') {
            return true;
          }
          if (!Character.isWhitespace(ch)) {
            return false;
          }
        } catch (IOException e) {
          return false;
        }
      }
    }
  }

  static final class JsonFlagFileParser extends FlagFileParser {
    private static final Gson gson = new Gson();

    @Override
    public FlagFileRep parse(InputStream input) throws FileDataException, IOException {
      try {
        return parseJson(gson.fromJson(new InputStreamReader(input, StandardCharsets.UTF_8), JsonElement.class));
      } catch (JsonParseException e) {
        throw new FileDataException("cannot parse JSON", e);
      }
    }

    public FlagFileRep parseJson(JsonElement tree) throws FileDataException {
      if (tree == null || tree.isJsonNull()) {
        return new FlagFileRep();
      }
      try {
        return gson.fromJson(tree, FlagFileRep.class);
      } catch (JsonParseException e) {
        throw new FileDataException("cannot parse JSON", e);
      }
    }
  }

  /**
   * Parses a FlagFileRep from a YAML file by converting the YAML tree to simple Java objects and
   * feeding those to the same Gson mapping that the JSON parser uses, so both formats produce
   * identical records.
   */
  static final class YamlFlagFileParser extends FlagFileParser {
    private static final Gson gson = new Gson();
    private static final JsonFlagFileParser jsonFileParser = new JsonFlagFileParser();

    @Override
    public FlagFileRep parse(InputStream input) throws FileDataException, IOException {
      Object root;
      try {
        // SafeConstructor only builds plain maps, lists, and scalars
        root = new Yaml(new SafeConstructor(new LoaderOptions())).load(input);
      } catch (YAMLException e) {
        throw new FileDataException("unable to parse YAML", e);
      }
      JsonElement jsonRoot = root == null ? new JsonObject() : gson.toJsonTree(timestampsToStrings(root));
      return jsonFileParser.parseJson(jsonRoot);
    }

    // YAML resolves unquoted timestamps to Date, which Gson would render in a locale format.
    private static Object timestampsToStrings(Object node) {
      if (node instanceof Date) {
        return ((Date)node).toInstant().toString();
      }
      if (node instanceof Map) {
        Map<Object, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e: ((Map<?, ?>)node).entrySet()) {
          copy.put(e.getKey(), timestampsToStrings(e.getValue()));
        }
        return copy;
      }
      if (node instanceof List) {
        List<Object> copy = new ArrayList<>();
        for (Object o: (List<?>)node) {
          copy.add(timestampsToStrings(o));
        }
        return copy;
      }
      return node;
    }
  }
}
