package com.ayios.fflags.integrations;

import com.ayios.fflags.integrations.FileFlagStoreBuilder.SourceInfo;
import com.ayios.fflags.integrations.FileFlagStoreParsing.FileDataException;
import com.ayios.fflags.integrations.FileFlagStoreParsing.FlagFileParser;
import com.ayios.fflags.integrations.FileFlagStoreParsing.FlagFileRep;
import com.ayios.fflags.integrations.FileFlagStoreParsing.FlagRecordRep;
import com.ayios.fflags.subsystems.FlagStore;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagQuery;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagRecord;
import com.google.common.collect.ImmutableList;
import com.launchdarkly.logging.LDLogger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Implements reading flag records from files, on every query.
 * <p>
 * A query fails as a whole if any source cannot be read or parsed; no partial result is returned.
 */
final class FileFlagStoreImpl implements FlagStore {
  private final List<SourceInfo> sources;
  private final FileData.DuplicateKeysHandling duplicateKeysHandling;
  private final LDLogger logger;

  FileFlagStoreImpl(
      List<SourceInfo> sources,
      FileData.DuplicateKeysHandling duplicateKeysHandling,
      LDLogger logger
      ) {
    this.sources = ImmutableList.copyOf(sources);
    this.duplicateKeysHandling = duplicateKeysHandling;
    this.logger = logger;
  }

  @Override
  public List<FlagRecord> query(FlagQuery query) throws IOException {
    List<FlagRecord> all = loadAll();
    ImmutableList.Builder<FlagRecord> result = ImmutableList.builder();
    for (FlagRecord r: all) {
      if (query.matches(r)) {
        result.add(r);
      }
    }
    return result.build();
  }

  List<FlagRecord> loadAll() throws IOException {
    List<FlagRecord> records = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (SourceInfo s: sources) {
      try {
        byte[] data = s.readData();
        FlagFileParser parser = FlagFileParser.selectForContent(data);
        FlagFileRep fileContents = parser.parse(new ByteArrayInputStream(data));
        if (fileContents.flags == null) {
          continue;
        }
        for (FlagRecordRep rep: fileContents.flags) {
          if (rep == null) {
            throw new FileDataException("flag list contains a null entry", null);
          }
          FlagRecord r = rep.toRecord();
          String key = r.getKind().getTag() + ":" + r.getId();
          if (!seen.add(key)) {
            if (duplicateKeysHandling == FileData.DuplicateKeysHandling.FAIL) {
              throw new FileDataException("in \"" + r.getKind().getTag() + "\", key \"" + r.getId() +
                  "\" was already defined", null, s);
            }
            logger.debug("Ignoring duplicate {} flag \"{}\" in {}", r.getKind().getTag(), r.getId(), s);
            continue;
          }
          records.add(r);
        }
      } catch (FileDataException e) {
        throw new IOException(e.withSource(s).getDescription(), e);
      } catch (IOException e) {
        throw new IOException("unable to read flag file " + s + ": " + e.getMessage(), e);
      }
    }
    return records;
  }

  @Override
  public void close() {}
}
