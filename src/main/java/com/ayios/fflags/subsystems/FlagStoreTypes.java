package com.ayios.fflags.subsystems;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.sdk.LDValueType;
import com.launchdarkly.sdk.ObjectBuilder;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Types that are used by the {@link FlagStore} interface.
 * <p>
 * Applications only need these types if they are implementing a custom flag store, or building
 * flag records for a test store.
 */
public abstract class FlagStoreTypes {
  private FlagStoreTypes() {}

  /**
   * The two partitions of the flag cache.
   * <p>
   * The cache keys every value on the pair of kind and flag id, so the same id can exist as both
   * a fast flag and a dynamic flag without collision.
   */
  public enum FlagKind {
    /**
     * Flags that are loaded once and never change for the lifetime of the client.
     */
    FAST("fast"),

    /**
     * Flags that are reloaded on every refresh cycle.
     */
    DYNAMIC("dynamic");

    private final String tag;

    private FlagKind(String tag) {
      this.tag = tag;
    }

    /**
     * Returns the type tag that identifies records of this kind in the backing store.
     *
     * @return "fast" or "dynamic"
     */
    public String getTag() {
      return tag;
    }

    /**
     * Finds the kind matching a stored type tag.
     *
     * @param tag the type tag
     * @return the matching kind, or null if the tag is unknown
     */
    public static FlagKind fromTag(String tag) {
      for (FlagKind k: values()) {
        if (k.tag.equals(tag)) {
          return k;
        }
      }
      return null;
    }
  }

  /**
   * A single flag as stored in the backing store.
   * <p>
   * Only {@link #getId()}, {@link #getKind()} and {@link #getValue()} are interpreted by the cache.
   * The other properties are carried for the benefit of query predicates and application code.
   */
  public static final class FlagRecord {
    private final String id;
    private final FlagKind kind;
    private final LDValue value;
    private final Instant createdAt;
    private final LDValue env;
    private final LDValue tags;
    private final String description;
    private final LDValue attributes;

    private FlagRecord(Builder b) {
      this.id = b.id;
      this.kind = b.kind;
      this.value = LDValue.normalize(b.value);
      this.createdAt = b.createdAt;
      this.env = LDValue.normalize(b.env);
      this.tags = LDValue.normalize(b.tags);
      this.description = b.description;
      this.attributes = b.attributes == null || b.attributes.isNull() ?
          LDValue.buildObject().build() : b.attributes;
    }

    /**
     * Starts building a record.
     *
     * @param id the flag id
     * @param kind the flag kind
     * @return a builder
     */
    public static Builder builder(String id, FlagKind kind) {
      return new Builder(id, kind);
    }

    /**
     * Shortcut for a record with only an id, kind, and value.
     *
     * @param id the flag id
     * @param kind the flag kind
     * @param value the flag value
     * @return a record
     */
    public static FlagRecord of(String id, FlagKind kind, LDValue value) {
      return builder(id, kind).value(value).build();
    }

    /**
     * The flag id, unique within its {@link FlagKind}.
     *
     * @return the id
     */
    public String getId() {
      return id;
    }

    /**
     * The flag kind.
     *
     * @return the kind
     */
    public FlagKind getKind() {
      return kind;
    }

    /**
     * The flag value. This is normally a string, number, boolean, or array of strings; it is never
     * null, but it can be {@link LDValue#ofNull()}.
     *
     * @return the value
     */
    public LDValue getValue() {
      return value;
    }

    /**
     * The creation time of the record, if known.
     *
     * @return a timestamp or null
     */
    public Instant getCreatedAt() {
      return createdAt;
    }

    /**
     * The environment the flag applies to: a scalar, a list, or {@link LDValue#ofNull()}.
     *
     * @return the environment value
     */
    public LDValue getEnv() {
      return env;
    }

    /**
     * The tags of the flag: a list, or {@link LDValue#ofNull()}.
     *
     * @return the tags
     */
    public LDValue getTags() {
      return tags;
    }

    /**
     * A human-readable description, if any.
     *
     * @return the description or null
     */
    public String getDescription() {
      return description;
    }

    /**
     * Caller-defined attributes. The cache never interprets these; they can be matched by query
     * predicates. Never null; defaults to an empty object.
     *
     * @return the attributes
     */
    public LDValue getAttributes() {
      return attributes;
    }

    /**
     * Returns the value of a named property as a JSON value, for use in query matching. The names
     * {@code id}, {@code type}, {@code env}, {@code tags}, {@code description}, and {@code createdAt}
     * refer to record properties; any other name is looked up in {@link #getAttributes()}.
     *
     * @param name the property name
     * @return the property value, or {@link LDValue#ofNull()} if there is none
     */
    public LDValue getProperty(String name) {
      switch (name) {
      case "id":
      case "_id":
        return LDValue.of(id);
      case "type":
        return LDValue.of(kind.getTag());
      case "env":
        return env;
      case "tags":
        return tags;
      case "description":
        return LDValue.of(description);
      case "createdAt":
        return createdAt == null ? LDValue.ofNull() : LDValue.of(createdAt.toString());
      default:
        return attributes.get(name);
      }
    }

    @Override
    public boolean equals(Object o) {
      if (o instanceof FlagRecord) {
        FlagRecord other = (FlagRecord)o;
        return Objects.equals(id, other.id) && kind == other.kind && value.equals(other.value) &&
            Objects.equals(createdAt, other.createdAt) && env.equals(other.env) && tags.equals(other.tags) &&
            Objects.equals(description, other.description) && attributes.equals(other.attributes);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, kind, value);
    }

    @Override
    public String toString() {
      return "FlagRecord(" + kind.getTag() + ":" + id + "=" + value + ")";
    }

    /**
     * Builder for {@link FlagRecord}.
     */
    public static final class Builder {
      private final String id;
      private final FlagKind kind;
      private LDValue value;
      private Instant createdAt;
      private LDValue env;
      private LDValue tags;
      private String description;
      private LDValue attributes;

      private Builder(String id, FlagKind kind) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
      }

      /**
       * Sets the flag value.
       *
       * @param value the value
       * @return the builder
       */
      public Builder value(LDValue value) {
        this.value = value;
        return this;
      }

      /**
       * Sets the creation time.
       *
       * @param createdAt the timestamp
       * @return the builder
       */
      public Builder createdAt(Instant createdAt) {
        this.createdAt = createdAt;
        return this;
      }

      /**
       * Sets the environment.
       *
       * @param env a scalar or list value
       * @return the builder
       */
      public Builder env(LDValue env) {
        this.env = env;
        return this;
      }

      /**
       * Sets the tags.
       *
       * @param tags a list value
       * @return the builder
       */
      public Builder tags(LDValue tags) {
        this.tags = tags;
        return this;
      }

      /**
       * Sets the description.
       *
       * @param description the description
       * @return the builder
       */
      public Builder description(String description) {
        this.description = description;
        return this;
      }

      /**
       * Sets the opaque attributes.
       *
       * @param attributes an object value
       * @return the builder
       */
      public Builder attributes(LDValue attributes) {
        this.attributes = attributes;
        return this;
      }

      /**
       * Builds the record.
       *
       * @return a new record
       */
      public FlagRecord build() {
        return new FlagRecord(this);
      }
    }
  }

  /**
   * Describes the records that a single load or refresh cycle asks the store for: every record of
   * one {@link FlagKind}, optionally narrowed by equality predicates.
   * <p>
   * Stores that can translate equality filters into their own query language (such as a document
   * store's {@code find} filter) should do so, writing the kind's type tag into the {@code type}
   * field. Stores that hold their data in memory can use {@link #matches(FlagRecord)}.
   */
  public static final class FlagQuery {
    private final FlagKind kind;
    private final ImmutableMap<String, LDValue> predicates;

    /**
     * Creates an instance.
     *
     * @param kind the kind of flags to fetch
     * @param predicates extra equality predicates; may be null or empty
     */
    public FlagQuery(FlagKind kind, Map<String, LDValue> predicates) {
      this.kind = Objects.requireNonNull(kind, "kind");
      this.predicates = predicates == null ? ImmutableMap.of() : ImmutableMap.copyOf(predicates);
    }

    /**
     * Creates a query for all flags of a kind.
     *
     * @param kind the kind
     * @return a query
     */
    public static FlagQuery allOf(FlagKind kind) {
      return new FlagQuery(kind, null);
    }

    /**
     * The kind of flags being queried.
     *
     * @return the kind
     */
    public FlagKind getKind() {
      return kind;
    }

    /**
     * Extra equality predicates, in addition to the kind's type tag.
     *
     * @return an immutable map, possibly empty
     */
    public Map<String, LDValue> getPredicates() {
      return predicates;
    }

    /**
     * Returns the whole query as a single filter object, with the type tag under {@code type}, in the
     * form a document store would accept.
     *
     * @return an object value
     */
    public LDValue toFilter() {
      ObjectBuilder b = LDValue.buildObject();
      for (Map.Entry<String, LDValue> e: predicates.entrySet()) {
        b.put(e.getKey(), e.getValue());
      }
      b.put("type", kind.getTag());
      return b.build();
    }

    /**
     * Tests whether a record satisfies this query.
     * <p>
     * The record must have this query's kind, and each predicate must match the record property of
     * the same name (see {@link FlagRecord#getProperty(String)}). A predicate matches if the values
     * are equal, or if the property is an array and the predicate is a non-array value contained in
     * it.
     *
     * @param record a record
     * @return true if the record matches
     */
    public boolean matches(FlagRecord record) {
      if (record.getKind() != kind) {
        return false;
      }
      for (Map.Entry<String, LDValue> e: predicates.entrySet()) {
        LDValue actual = record.getProperty(e.getKey());
        LDValue expected = e.getValue();
        if (actual.equals(expected)) {
          continue;
        }
        if (actual.getType() == LDValueType.ARRAY && expected.getType() != LDValueType.ARRAY) {
          boolean found = false;
          for (LDValue element: actual.values()) {
            if (element.equals(expected)) {
              found = true;
              break;
            }
          }
          if (found) {
            continue;
          }
        }
        return false;
      }
      return true;
    }

    @Override
    public boolean equals(Object o) {
      if (o instanceof FlagQuery) {
        FlagQuery other = (FlagQuery)o;
        return kind == other.kind && predicates.equals(other.predicates);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, predicates);
    }

    @Override
    public String toString() {
      return "FlagQuery(" + toFilter().toJsonString() + ")";
    }
  }
}
