package com.ayios.fflags.integrations;

import com.ayios.fflags.BaseTest;
import com.ayios.fflags.subsystems.FlagStore;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagQuery;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagRecord;
import com.google.common.collect.ImmutableMap;
import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.testhelpers.TempDir;
import com.launchdarkly.testhelpers.TempFile;

import org.junit.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.ayios.fflags.TestComponents.clientContext;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class FileFlagStoreTest extends BaseTest {
  private static final String JSON_TWO_FLAGS =
      "{\"flags\":[{\"_id\":\"a\",\"type\":\"fast\",\"value\":1},{\"_id\":\"b\",\"type\":\"dynamic\",\"value\":2}]}";

  private FlagStore makeStore(FileFlagStoreBuilder builder) {
    return builder.build(clientContext(testLogging));
  }

  private static List<String> ids(List<FlagRecord> records) {
    List<String> ret = new ArrayList<>();
    for (FlagRecord r: records) {
      ret.add(r.getId());
    }
    return ret;
  }

  @Test
  public void loadsJsonFromClasspath() throws Exception {
    try (FlagStore store = makeStore(FileData.flagStore().classpathResources("flagstore/flags.json"))) {
      verifyFixtureContents(store);
    }
  }

  @Test
  public void loadsYamlFromClasspath() throws Exception {
    try (FlagStore store = makeStore(FileData.flagStore().classpathResources("flagstore/flags.yml"))) {
      verifyFixtureContents(store);
    }
  }

  private void verifyFixtureContents(FlagStore store) throws IOException {
    List<FlagRecord> fast = store.query(FlagQuery.allOf(FlagKind.FAST));
    assertThat(ids(fast), contains("checkout-v2"));
    FlagRecord checkout = fast.get(0);
    assertThat(checkout.getValue(), equalTo(LDValue.of(true)));
    assertThat(checkout.getEnv(), equalTo(LDValue.of("prod")));
    assertThat(checkout.getDescription(), equalTo("Enables the new checkout flow"));

    List<FlagRecord> dynamic = store.query(FlagQuery.allOf(FlagKind.DYNAMIC));
    assertThat(ids(dynamic), contains("checkout-timeout", "allowed-regions"));
    assertThat(dynamic.get(0).getValue(), equalTo(LDValue.of(5000)));
    assertThat(dynamic.get(0).getTags(), equalTo(LDValue.buildArray().add("checkout").build()));
    FlagRecord regions = dynamic.get(1);
    assertThat(regions.getValue(), equalTo(LDValue.buildArray().add("eu").add("us").build()));
    assertThat(regions.getCreatedAt(), equalTo(Instant.parse("2024-03-01T12:00:00Z")));
    assertThat(regions.getAttributes().get("owner"), equalTo(LDValue.of("payments")));
  }

  @Test
  public void predicatesAreApplied() throws Exception {
    try (FlagStore store = makeStore(FileData.flagStore().classpathResources("flagstore/flags.json"))) {
      FlagQuery stagingQuery = new FlagQuery(FlagKind.DYNAMIC, ImmutableMap.of("env", LDValue.of("staging")));
      assertThat(ids(store.query(stagingQuery)), contains("checkout-timeout"));

      FlagQuery ownerQuery = new FlagQuery(FlagKind.DYNAMIC, ImmutableMap.of("owner", LDValue.of("payments")));
      assertThat(ids(store.query(ownerQuery)), contains("allowed-regions"));
    }
  }

  @Test
  public void fileIsReadAgainOnEveryQuery() throws Exception {
    try (TempDir dir = TempDir.create()) {
      try (TempFile file = dir.tempFile(".json")) {
        file.setContents(JSON_TWO_FLAGS);
        try (FlagStore store = makeStore(FileData.flagStore().filePaths(file.getPath()))) {
          assertThat(store.query(FlagQuery.allOf(FlagKind.DYNAMIC)).get(0).getValue(), equalTo(LDValue.of(2)));

          file.setContents(JSON_TWO_FLAGS.replace("\"value\":2", "\"value\":3"));

          assertThat(store.query(FlagQuery.allOf(FlagKind.DYNAMIC)).get(0).getValue(), equalTo(LDValue.of(3)));
        }
      }
    }
  }

  @Test
  public void recordsFromMultipleFilesAreCombined() throws Exception {
    try (TempDir dir = TempDir.create()) {
      try (TempFile file1 = dir.tempFile(".json"); TempFile file2 = dir.tempFile(".yml")) {
        file1.setContents(JSON_TWO_FLAGS);
        file2.setContents("flags:\n  - _id: c\n    type: dynamic\n    value: x\n");
        try (FlagStore store = makeStore(FileData.flagStore().filePaths(file1.getPath(), file2.getPath()))) {
          assertThat(ids(store.query(FlagQuery.allOf(FlagKind.DYNAMIC))), contains("b", "c"));
        }
      }
    }
  }

  @Test
  public void duplicateIdFailsByDefault() throws Exception {
    try (TempDir dir = TempDir.create()) {
      try (TempFile file1 = dir.tempFile(".json"); TempFile file2 = dir.tempFile(".json")) {
        file1.setContents(JSON_TWO_FLAGS);
        file2.setContents(JSON_TWO_FLAGS);
        try (FlagStore store = makeStore(FileData.flagStore().filePaths(file1.getPath(), file2.getPath()))) {
          expectQueryFailure(store, "already defined");
        }
      }
    }
  }

  @Test
  public void duplicateIdCanBeIgnored() throws Exception {
    try (TempDir dir = TempDir.create()) {
      try (TempFile file1 = dir.tempFile(".json"); TempFile file2 = dir.tempFile(".json")) {
        file1.setContents(JSON_TWO_FLAGS);
        file2.setContents(JSON_TWO_FLAGS.replace("\"value\":1", "\"value\":99"));
        FileFlagStoreBuilder builder = FileData.flagStore()
            .filePaths(file1.getPath(), file2.getPath())
            .duplicateKeysHandling(FileData.DuplicateKeysHandling.IGNORE);
        try (FlagStore store = makeStore(builder)) {
          List<FlagRecord> fast = store.query(FlagQuery.allOf(FlagKind.FAST));
          assertThat(ids(fast), contains("a"));
          assertThat(fast.get(0).getValue(), equalTo(LDValue.of(1)));
        }
      }
    }
  }

  @Test
  public void sameIdWithDifferentKindIsNotDuplicate() throws Exception {
    try (TempDir dir = TempDir.create()) {
      try (TempFile file = dir.tempFile(".json")) {
        file.setContents("{\"flags\":[{\"_id\":\"a\",\"type\":\"fast\",\"value\":1}," +
            "{\"_id\":\"a\",\"type\":\"dynamic\",\"value\":2}]}");
        try (FlagStore store = makeStore(FileData.flagStore().filePaths(file.getPath()))) {
          assertThat(ids(store.query(FlagQuery.allOf(FlagKind.FAST))), contains("a"));
          assertThat(ids(store.query(FlagQuery.allOf(FlagKind.DYNAMIC))), contains("a"));
        }
      }
    }
  }

  @Test
  public void invalidJsonFailsQuery() throws Exception {
    expectFileFailure("{\"flags\": [", "cannot parse JSON");
  }

  @Test
  public void invalidYamlFailsQuery() throws Exception {
    expectFileFailure("flags: [\n  - a: [", "unable to parse YAML");
  }

  @Test
  public void unknownTypeFailsQuery() throws Exception {
    expectFileFailure("{\"flags\":[{\"_id\":\"a\",\"type\":\"slow\",\"value\":1}]}", "unknown type \"slow\"");
  }

  @Test
  public void missingIdFailsQuery() throws Exception {
    expectFileFailure("{\"flags\":[{\"type\":\"fast\",\"value\":1}]}", "has no id");
  }

  @Test
  public void nullRecordFailsQuery() throws Exception {
    expectFileFailure("{\"flags\":[null]}", "null entry");
  }

  @Test
  public void nullRecordInYamlFailsQuery() throws Exception {
    expectFileFailure("flags:\n  - ~\n", "null entry");
  }

  @Test
  public void invalidTimestampFailsQuery() throws Exception {
    expectFileFailure("{\"flags\":[{\"_id\":\"a\",\"type\":\"fast\",\"value\":1,\"createdAt\":\"yesterday\"}]}",
        "invalid createdAt");
  }

  @Test
  public void emptyFileHasNoFlags() throws Exception {
    try (TempDir dir = TempDir.create()) {
      try (TempFile file = dir.tempFile(".yml")) {
        file.setContents("");
        try (FlagStore store = makeStore(FileData.flagStore().filePaths(file.getPath()))) {
          assertThat(store.query(FlagQuery.allOf(FlagKind.FAST)).isEmpty(), equalTo(true));
        }
      }
    }
  }

  @Test
  public void missingFileFailsQuery() throws Exception {
    try (FlagStore store = makeStore(FileData.flagStore().filePaths("no-such-file.json"))) {
      expectQueryFailure(store, "unable to read flag file");
    }
  }

  @Test
  public void missingClasspathResourceFailsQuery() throws Exception {
    try (FlagStore store = makeStore(FileData.flagStore().classpathResources("flagstore/missing.json"))) {
      expectQueryFailure(store, "classpath resource not found");
    }
  }

  private void expectFileFailure(String contents, String expectedMessage) throws Exception {
    try (TempDir dir = TempDir.create()) {
      try (TempFile file = dir.tempFile(".txt")) {
        file.setContents(contents);
        try (FlagStore store = makeStore(FileData.flagStore().filePaths(file.getPath()))) {
          expectQueryFailure(store, expectedMessage);
        }
      }
    }
  }

  private static void expectQueryFailure(FlagStore store, String expectedMessage) {
    try {
      store.query(FlagQuery.allOf(FlagKind.FAST));
      fail("expected exception");
    } catch (IOException e) {
      assertThat(e.getMessage(), containsString(expectedMessage));
    }
  }
}
