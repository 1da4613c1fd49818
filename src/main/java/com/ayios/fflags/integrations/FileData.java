package com.ayios.fflags.integrations;

/**
 * Integration between the flag client and JSON or YAML files that contain flag records.
 * <p>
 * This is useful for local development, for tests, and for deployments that ship their flags as
 * configuration files. The files are re-read on every query, so editing a file changes dynamic
 * flags at the next refresh cycle.
 * <p>
 * A file contains an object with a {@code flags} array. Each element is a flag record:
 * <pre>
 *     {
 *       "flags": [
 *         { "_id": "new-checkout", "type": "fast", "value": true },
 *         { "_id": "checkout-timeout", "type": "dynamic", "value": 5000, "env": "prod" },
 *         { "_id": "DynamicFFlagRefreshRate", "type": "dynamic", "value": 30000,
 *           "description": "refresh interval in milliseconds", "tags": [ "core" ] }
 *       ]
 *     }
 * </pre>
 * The id may be given as {@code id} or {@code _id}. {@code createdAt} is an ISO-8601 timestamp; in
 * YAML it must be quoted. Other properties ({@code env}, {@code tags}, {@code description},
 * {@code attributes}) are optional.
 */
public abstract class FileData {
  /**
   * Determines how duplicate flag ids (within one kind) are handled.
   *
   * @see FileFlagStoreBuilder#duplicateKeysHandling(DuplicateKeysHandling)
   */
  public enum DuplicateKeysHandling {
    /**
     * Duplicate ids make the query fail. This is the default.
     */
    FAIL,

    /**
     * The first occurrence of an id wins and later ones are ignored.
     */
    IGNORE
  }

  /**
   * Creates a {@link FileFlagStoreBuilder} which you can use to configure the file store.
   *
   * <pre><code>
   *     FFlagsConfig config = new FFlagsConfig.Builder()
   *         .flagStore(FileData.flagStore().filePaths("flags.json"))
   *         .build();
   * </code></pre>
   *
   * @return a builder
   */
  public static FileFlagStoreBuilder flagStore() {
    return new FileFlagStoreBuilder();
  }

  private FileData() {}
}
