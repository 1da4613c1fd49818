package com.ayios.fflags.integrations;

import com.ayios.fflags.subsystems.ClientContext;
import com.ayios.fflags.subsystems.ComponentConfigurer;
import com.ayios.fflags.subsystems.FlagStore;
import com.google.common.io.ByteStreams;
import com.launchdarkly.logging.LDLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * To use the file flag store, obtain a new instance of this class with {@link FileData#flagStore()};
 * call the builder method {@link #filePaths(String...)} to specify file path(s), and/or
 * {@link #classpathResources(String...)} to specify classpath data resources; then pass the
 * resulting object to {@link com.ayios.fflags.FFlagsConfig.Builder#flagStore(ComponentConfigurer)}.
 * <p>
 * For more details, see {@link FileData}.
 */
public final class FileFlagStoreBuilder implements ComponentConfigurer<FlagStore> {
  final List<SourceInfo> sources = new ArrayList<>(); // visible for tests
  private FileData.DuplicateKeysHandling duplicateKeysHandling = FileData.DuplicateKeysHandling.FAIL;

  /**
   * Adds any number of source files for loading flag data, specifying each file path as a string. The
   * files will not actually be read until a query is made.
   * <p>
   * Files will be parsed as JSON if their first non-whitespace character is '{'. Otherwise, they will
   * be parsed as YAML.
   *
   * @param filePaths path(s) to the source file(s); may be absolute or relative to the current working directory
   * @return the same builder
   *
   * @throws InvalidPathException if one of the parameters is not a valid file path
   */
  public FileFlagStoreBuilder filePaths(String... filePaths) throws InvalidPathException {
    for (String p: filePaths) {
      sources.add(new FilePathSourceInfo(Paths.get(p)));
    }
    return this;
  }

  /**
   * Adds any number of source files for loading flag data, specifying each file path as a Path.
   *
   * @param filePaths path(s) to the source file(s); may be absolute or relative to the current working directory
   * @return the same builder
   */
  public FileFlagStoreBuilder filePaths(Path... filePaths) {
    for (Path p: filePaths) {
      sources.add(new FilePathSourceInfo(p));
    }
    return this;
  }

  /**
   * Adds any number of classpath resources for loading flag data.
   *
   * @param resourceLocations resource location(s) in the format used by {@code ClassLoader.getResource()}
   * @return the same builder
   */
  public FileFlagStoreBuilder classpathResources(String... resourceLocations) {
    for (String location: resourceLocations) {
      sources.add(new ClasspathResourceSourceInfo(location));
    }
    return this;
  }

  /**
   * Specifies how to handle the same flag id appearing more than once for the same kind, either
   * within one file or across files. The default is {@link FileData.DuplicateKeysHandling#FAIL}.
   *
   * @param duplicateKeysHandling specifies how to handle duplicate ids
   * @return the same builder
   */
  public FileFlagStoreBuilder duplicateKeysHandling(FileData.DuplicateKeysHandling duplicateKeysHandling) {
    this.duplicateKeysHandling = duplicateKeysHandling;
    return this;
  }

  @Override
  public FlagStore build(ClientContext context) {
    LDLogger logger = context.getBaseLogger().subLogger("Store");
    return new FileFlagStoreImpl(sources, duplicateKeysHandling, logger);
  }

  static abstract class SourceInfo {
    abstract byte[] readData() throws IOException;
  }

  static final class FilePathSourceInfo extends SourceInfo {
    final Path path;

    FilePathSourceInfo(Path path) {
      this.path = path;
    }

    @Override
    byte[] readData() throws IOException {
      return Files.readAllBytes(path);
    }

    @Override
    public String toString() {
      return path.toString();
    }
  }

  static final class ClasspathResourceSourceInfo extends SourceInfo {
    final String location;

    ClasspathResourceSourceInfo(String location) {
      this.location = location;
    }

    @Override
    byte[] readData() throws IOException {
      try (InputStream is = getClass().getClassLoader().getResourceAsStream(location)) {
        if (is == null) {
          throw new IOException("classpath resource not found");
        }
        return ByteStreams.toByteArray(is);
      }
    }

    @Override
    public String toString() {
      return "classpath:" + location;
    }
  }
}
