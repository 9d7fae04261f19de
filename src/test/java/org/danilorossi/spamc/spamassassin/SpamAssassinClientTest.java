package org.danilorossi.spamc.spamassassin;

import static org.junit.jupiter.api.Assertions.*;

import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import lombok.val;
import org.danilorossi.spamc.codec.SpamdCodec;
import org.danilorossi.spamc.db.JsonDb;
import org.danilorossi.spamc.error.DaemonException;
import org.danilorossi.spamc.error.MalformedHeaderException;
import org.danilorossi.spamc.helpers.FileSystemUtils;
import org.danilorossi.spamc.model.SpamdClientConfig;
import org.danilorossi.spamc.protocol.ActionOption;
import org.danilorossi.spamc.protocol.Command;
import org.danilorossi.spamc.protocol.Headers;
import org.danilorossi.spamc.protocol.MessageClass;
import org.danilorossi.spamc.protocol.Request;
import org.danilorossi.spamc.protocol.Response;
import org.danilorossi.spamc.protocol.Status;
import org.danilorossi.spamc.transport.FakeSpamd;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SpamAssassinClientTest {

  private static final String SAMPLE =
      "From: test@example.com\r\n"
          + "To: you@example.com\r\n"
          + "Subject: Hello!\r\n"
          + "Message-ID: <abc@example.com>\r\n"
          + "Content-Type: text/plain; charset=UTF-8\r\n"
          + "\r\n"
          + "Just a friendly test.\r\n";

  private static final String SPAM_HEADER = "True ; 6.5 / 5.0";

  /** Answers like spamd would for a message it considers spam. */
  private static void spamd(final FakeSpamd.Received req, final OutputStream out)
      throws IOException {
    val headers = new Headers();
    byte[] body = null;
    switch (req.verb()) {
      case "PING" -> {
        out.write("SPAMD/1.5 0 PONG\r\n".getBytes(StandardCharsets.US_ASCII));
        return;
      }
      case "CHECK" -> headers.add("Spam", SPAM_HEADER);
      case "SYMBOLS" -> {
        headers.add("Spam", SPAM_HEADER);
        body = "BAYES_99,HTML_MESSAGE, URIBL_BLOCKED\n".getBytes(StandardCharsets.US_ASCII);
      }
      case "REPORT", "REPORT_IFSPAM" -> {
        headers.add("Spam", SPAM_HEADER);
        body = "Spam detection software has identified...".getBytes(StandardCharsets.US_ASCII);
      }
      case "PROCESS" -> {
        headers.add("Spam", SPAM_HEADER);
        body = ("X-Spam-Flag: YES\r\n" + SAMPLE).getBytes(StandardCharsets.UTF_8);
      }
      case "HEADERS" -> {
        headers.add("Spam", SPAM_HEADER);
        body = "X-Spam-Flag: YES\r\nSubject: Hello!\r\n\r\n".getBytes(StandardCharsets.UTF_8);
      }
      case "TELL" -> {
        if (req.getHeaders().contains("Set"))
          headers.add("DidSet", req.getHeaders().get("Set").orElseThrow());
        if (req.getHeaders().contains("Remove"))
          headers.add("DidRemove", req.getHeaders().get("Remove").orElseThrow());
      }
      default -> {
        out.write("SPAMD/1.5 76 Bad header line\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
        return;
      }
    }
    out.write(
        SpamdCodec.encode(
            Response.builder()
                .protocolVersion("1.5")
                .statusCode(0)
                .statusMessage("EX_OK")
                .headers(headers)
                .body(body)
                .build()));
  }

  private FakeSpamd daemon;
  private SpamAssassinClient client;

  @BeforeEach
  public void setUp() throws IOException {
    daemon = FakeSpamd.tcp(SpamAssassinClientTest::spamd);
    client = clientFor(daemon, SpamdClientConfig.builder());
  }

  @AfterEach
  public void tearDown() throws IOException {
    client.close();
    daemon.close();
  }

  private static SpamAssassinClient clientFor(
      final FakeSpamd spamd, final SpamdClientConfig.SpamdClientConfigBuilder cfg) {
    return SpamAssassinClient.builder().config(cfg.build()).endpoint(spamd.getEndpoint()).build();
  }

  @Test
  public void check() throws Exception {
    val result = client.check(SAMPLE);
    assertTrue(result.isSpam());
    assertEquals(6.5, result.getScore(), 1e-9);
    assertEquals(5.0, result.getThreshold(), 1e-9);
    assertEquals("CHECK SPAMC/1.5", daemon.last().getRequestLine());
    assertArrayEquals(SAMPLE.getBytes(StandardCharsets.UTF_8), daemon.last().getBody());
    assertFalse(daemon.last().getHeaders().contains("User"));
  }

  @Test
  public void symbols() throws Exception {
    val result = client.symbols(SAMPLE.getBytes(StandardCharsets.UTF_8));
    assertTrue(result.isSpam());
    assertEquals(List.of("BAYES_99", "HTML_MESSAGE", "URIBL_BLOCKED"), result.getSymbols());
    assertTrue(result.getSymbolsRaw().startsWith("BAYES_99"));
  }

  @Test
  public void reportAndReportIfSpam() throws Exception {
    val report = client.report(SAMPLE);
    assertTrue(report.hasReport());
    assertTrue(report.getReport().startsWith("Spam detection"));
    assertEquals("REPORT SPAMC/1.5", daemon.last().getRequestLine());

    val ifSpam = client.reportIfSpam(SAMPLE);
    assertTrue(ifSpam.isSpam());
    assertEquals("REPORT_IFSPAM SPAMC/1.5", daemon.last().getRequestLine());
  }

  @Test
  public void reportIfSpamForHamHasEmptyReport() throws Exception {
    val ham =
        FakeSpamd.reply(
            Response.builder()
                .protocolVersion("1.5")
                .statusCode(0)
                .statusMessage("EX_OK")
                .headers(Headers.of("Spam", "False ; 0.3 / 5.0", "Content-length", "0"))
                .build());
    try (val hamd = FakeSpamd.tcp(ham);
        val hamClient = clientFor(hamd, SpamdClientConfig.builder())) {
      val result = hamClient.reportIfSpam(SAMPLE);
      assertFalse(result.isSpam());
      assertFalse(result.hasReport());
      assertEquals("", result.getReport());
    }
  }

  @Test
  public void processAndHeaders() throws Exception {
    val processed = client.process(SAMPLE);
    assertTrue(processed.messageAsString().startsWith("X-Spam-Flag: YES\r\nFrom:"));
    assertTrue(processed.getScore().isSpam());

    val headers = client.headers(SAMPLE);
    assertEquals("X-Spam-Flag: YES\r\nSubject: Hello!\r\n\r\n", headers.messageAsString());
    assertEquals("HEADERS SPAMC/1.5", daemon.last().getRequestLine());
  }

  @Test
  public void ping() throws Exception {
    val pong = client.ping();
    assertEquals("1.5", pong.getVersion());
    assertEquals("PONG", pong.getMessage());
    assertEquals("PING SPAMC/1.5", daemon.last().getRequestLine());
    assertNull(daemon.last().getBody());
    assertTrue(daemon.last().getHeaders().isEmpty());
  }

  @Test
  public void tell() throws Exception {
    val result =
        client.tell(SAMPLE, MessageClass.SPAM, ActionOption.BOTH, ActionOption.NONE);
    assertEquals(ActionOption.BOTH, result.getDidSet());
    assertEquals(ActionOption.NONE, result.getDidRemove());
    val sent = daemon.last().getHeaders();
    assertEquals("spam", sent.get("Message-class").orElseThrow());
    assertEquals("local, remote", sent.get("Set").orElseThrow());
    assertFalse(sent.contains("Remove"));

    val forget = client.tell(SAMPLE, MessageClass.HAM, null, ActionOption.LOCAL);
    assertEquals(ActionOption.NONE, forget.getDidSet());
    assertEquals(ActionOption.LOCAL, forget.getDidRemove());
  }

  @Test
  public void tellWithCallOptions(@TempDir final Path dir) throws Exception {
    try (val local = FakeSpamd.unix(dir.resolve("spamd.sock"), SpamAssassinClientTest::spamd)) {
      val opt =
          CallOptions.builder()
              .endpoint(local.getEndpoint())
              .timeout(Duration.ofSeconds(2))
              .user("trainer")
              .build();
      val learned = client.tell(SAMPLE, MessageClass.SPAM, ActionOption.LOCAL, null, opt);
      assertEquals(ActionOption.LOCAL, learned.getDidSet());
      assertEquals("trainer", local.last().getHeaders().get("User").orElseThrow());

      val message = new MimeMessage(Session.getInstance(new Properties()));
      message.setSubject("Train me");
      message.setText("ham body", "UTF-8");
      client.tell(message, MessageClass.HAM, ActionOption.LOCAL, null, opt);
      assertEquals("ham", local.last().getHeaders().get("Message-class").orElseThrow());
      assertTrue(new String(local.last().getBody(), StandardCharsets.UTF_8).contains("ham body"));

      assertTrue(client.check(SAMPLE, opt).isSpam());
      assertEquals(3, local.getReceived().size());
      assertEquals(0, daemon.getReceived().size());
    }
  }

  @Test
  public void userFromConfigAndPerCallOverride() throws Exception {
    try (val alice = clientFor(daemon, SpamdClientConfig.builder().user("alice"))) {
      alice.check(SAMPLE);
      assertEquals("alice", daemon.last().getHeaders().get("User").orElseThrow());
      alice.check(
          SAMPLE.getBytes(StandardCharsets.UTF_8), CallOptions.builder().user("bob").build());
      assertEquals("bob", daemon.last().getHeaders().get("User").orElseThrow());
    }
  }

  @Test
  public void compressedRequestBody() throws Exception {
    try (val zipped = clientFor(daemon, SpamdClientConfig.builder().compress(true))) {
      assertTrue(zipped.check(SAMPLE).isSpam());
      val sent = daemon.last();
      assertEquals("zlib", sent.getHeaders().get("Compress").orElseThrow());
      assertTrue(sent.getRequest().isCompress());
      assertEquals(SAMPLE, new String(sent.getBody(), StandardCharsets.UTF_8));
      val wireLength = Integer.parseInt(sent.getHeaders().get("Content-length").orElseThrow());
      assertNotEquals(SAMPLE.getBytes(StandardCharsets.UTF_8).length, wireLength);
      zipped.ping();
      assertFalse(daemon.last().getHeaders().contains("Compress"));
    }
  }

  @Test
  public void jakartaMessageIsSentAsRfc822() throws Exception {
    val message = new MimeMessage(Session.getInstance(new Properties()));
    message.setFrom(new InternetAddress("test@example.com"));
    message.setSubject("Hello from jakarta");
    message.setText("Just a friendly test.", "UTF-8");
    assertTrue(client.check(message).isSpam());
    val sent = new String(daemon.last().getBody(), StandardCharsets.UTF_8);
    assertTrue(sent.contains("Subject: Hello from jakarta"));
    assertTrue(sent.contains("Just a friendly test."));
  }

  @Test
  public void nonOkStatusBecomesDaemonException() throws Exception {
    try (val busy = FakeSpamd.tcp(FakeSpamd.raw("SPAMD/1.5 69 Service unavailable\r\n\r\n"));
        val c = clientFor(busy, SpamdClientConfig.builder())) {
      val e = assertThrows(DaemonException.class, () -> c.check(SAMPLE));
      assertEquals(69, e.getStatusCode());
      assertEquals(Status.EX_UNAVAILABLE, e.getStatus().orElseThrow());
      assertEquals(Command.CHECK, e.getCommand());
    }
  }

  @Test
  public void missingSpamHeaderIsMalformed() throws Exception {
    try (val odd = FakeSpamd.tcp(FakeSpamd.raw("SPAMD/1.5 0 EX_OK\r\nContent-length: 0\r\n\r\n"));
        val c = clientFor(odd, SpamdClientConfig.builder())) {
      assertThrows(MalformedHeaderException.class, () -> c.check(SAMPLE));
    }
  }

  @Test
  public void executeExposesRawResponses() throws Exception {
    val r = client.execute(Request.newRequest(Command.SYMBOLS, null, SAMPLE.getBytes(StandardCharsets.UTF_8)));
    assertTrue(r.isOk());
    assertEquals(SPAM_HEADER, r.getHeaders().get("spam").orElseThrow());
    val async = client.executeAsync(Request.newRequest(Command.PING, null, null)).get();
    assertEquals("PONG", async.getStatusMessage());
  }

  @Test
  public void perCallEndpointAndTimeout(@TempDir final Path dir) throws Exception {
    try (val local = FakeSpamd.unix(dir.resolve("spamd.sock"), SpamAssassinClientTest::spamd)) {
      val opt =
          CallOptions.builder()
              .endpoint(local.getEndpoint())
              .timeout(Duration.ofSeconds(2))
              .build();
      assertEquals("PONG", client.ping(opt).getMessage());
      assertEquals(1, local.getReceived().size());
      assertEquals(0, daemon.getReceived().size());
    }
    assertThrows(
        IllegalArgumentException.class,
        () -> client.ping(CallOptions.builder().timeout(Duration.ZERO).build()));
  }

  @Test
  public void unixSocketFromConfig(@TempDir final Path dir) throws Exception {
    val socket = dir.resolve("spamd.sock");
    try (val local = FakeSpamd.unix(socket, SpamAssassinClientTest::spamd);
        val c =
            SpamAssassinClient.newFromConfig(
                SpamdClientConfig.builder().socketPath(socket.toString()).build())) {
      assertTrue(c.check(SAMPLE).isSpam());
      assertEquals(1, local.getReceived().size());
    }
  }

  @Test
  public void storedConfigDrivesTheClient(@TempDir final Path dir) throws Exception {
    val socket = dir.resolve("spamd.sock");
    System.setProperty(FileSystemUtils.PROP_HOME, dir.toString());
    try (val local = FakeSpamd.unix(socket, SpamAssassinClientTest::spamd)) {
      try (val db = new JsonDb()) {
        db.config()
            .save(SpamdClientConfig.builder().socketPath(socket.toString()).user("mailer").build());
      }
      try (val c = SpamAssassinClient.newFromStoredConfig()) {
        assertEquals("mailer", c.getConfig().getUser());
        assertTrue(c.check(SAMPLE).isSpam());
        assertEquals("mailer", local.last().getHeaders().get("User").orElseThrow());
      }
    } finally {
      System.clearProperty(FileSystemUtils.PROP_HOME);
    }
  }

  @Test
  public void parseSymbolsToleratesSpacingAndEmptyBody() {
    assertEquals(List.of("A", "B"), SpamAssassinClient.parseSymbols(" A , B\r\n"));
    assertTrue(SpamAssassinClient.parseSymbols("").isEmpty());
  }
}
