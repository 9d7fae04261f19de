package org.danilorossi.spamc.db;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import lombok.val;
import org.danilorossi.spamc.helpers.FileSystemUtils;
import org.danilorossi.spamc.model.SpamdClientConfig;
import org.danilorossi.spamc.pool.PoolPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class JsonDbTest {

  @TempDir Path home;

  @BeforeEach
  public void pointDataDirToTemp() {
    System.setProperty(FileSystemUtils.PROP_HOME, home.toString());
  }

  @AfterEach
  public void restore() {
    System.clearProperty(FileSystemUtils.PROP_HOME);
  }

  @Test
  public void missingFileGivesDefaults() {
    try (val db = new JsonDb()) {
      val cfg = db.config().load();
      assertEquals("127.0.0.1", cfg.getHost());
      assertEquals(783, cfg.getPort());
      assertEquals(PoolPolicy.WAIT, cfg.getPoolPolicy());
      assertFalse(cfg.isReuseConnections());
    }
  }

  @Test
  public void saveThenLoad() {
    try (val db = new JsonDb()) {
      val cfg =
          SpamdClientConfig.builder()
              .host("spamd.internal")
              .port(7830)
              .user("mailer")
              .compress(true)
              .poolPolicy(PoolPolicy.FAIL_FAST)
              .maxConnections(3)
              .build();
      db.config().save(cfg);
      assertTrue(Files.exists(home.resolve("spamc.json")));
      assertEquals(cfg, db.config().load());
    }
  }

  @Test
  public void partialJsonKeepsDefaultsForMissingFields() throws Exception {
    Files.writeString(home.resolve("spamc.json"), "{ \"host\": \"10.1.1.1\" }");
    try (val db = new JsonDb()) {
      val cfg = db.config().load();
      assertEquals("10.1.1.1", cfg.getHost());
      assertEquals(783, cfg.getPort());
      assertEquals(3000, cfg.getConnectTimeoutMillis());
      assertEquals("1.5", cfg.getProtocolVersion());
    }
  }

  @Test
  public void corruptJsonFallsBackToDefaults() throws Exception {
    Files.writeString(home.resolve("spamc.json"), "{ not json");
    try (val db = new JsonDb()) {
      assertEquals(SpamdClientConfig.builder().build(), db.config().load());
    }
  }

  @Test
  public void invalidConfigIsNotSaved() {
    try (val db = new JsonDb()) {
      val bad = SpamdClientConfig.builder().port(0).build();
      assertThrows(IllegalArgumentException.class, () -> db.config().save(bad));
      assertFalse(Files.exists(home.resolve("spamc.json")));
    }
  }
}
