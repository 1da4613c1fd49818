package com.ayios.fflags.subsystems;

import com.ayios.fflags.subsystems.FlagStoreTypes.FlagQuery;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagRecord;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Interface for the backing store that the client reads flag records from.
 * <p>
 * The client never writes to the store. It calls {@link #query(FlagQuery)} once for the initial load
 * of fast flags, and once per refresh cycle for dynamic flags, always from its own worker thread; an
 * implementation may block for as long as its I/O takes.
 * <p>
 * Built-in implementations are {@link com.ayios.fflags.integrations.TestFlagStore} and
 * {@link com.ayios.fflags.integrations.FileData#flagStore()}. To use a database, implement this
 * interface by translating {@link FlagQuery#toFilter()} into the database's own equality query.
 */
public interface FlagStore extends Closeable {
  /**
   * Fetches every record that matches the query.
   * <p>
   * The result should be all-or-nothing: if the query cannot be completed, throw an exception
   * rather than returning a partial list. Records are processed in the order returned.
   *
   * @param query the kind and extra predicates
   * @return the matching records; never null
   * @throws IOException if the store could not be read
   */
  List<FlagRecord> query(FlagQuery query) throws IOException;
}
