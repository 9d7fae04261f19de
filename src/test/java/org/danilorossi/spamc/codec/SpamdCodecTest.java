package org.danilorossi.spamc.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import lombok.val;
import org.danilorossi.spamc.error.EncodeException;
import org.danilorossi.spamc.protocol.Command;
import org.danilorossi.spamc.protocol.Headers;
import org.danilorossi.spamc.protocol.Request;
import org.danilorossi.spamc.protocol.Response;
import org.junit.jupiter.api.Test;

public class SpamdCodecTest {

  private static final byte[] TWELVE = "Subject: x\r\n".getBytes(StandardCharsets.US_ASCII);

  private static String ascii(final byte[] b) {
    return new String(b, StandardCharsets.ISO_8859_1);
  }

  @Test
  public void pingEncodesWithoutContentLength() {
    val wire = SpamdCodec.encode(Request.newRequest(Command.PING, null, null));
    assertEquals("PING SPAMC/1.5\r\n\r\n", ascii(wire));
  }

  @Test
  public void checkAlwaysCarriesContentLengthFirst() {
    assertEquals(12, TWELVE.length);
    val wire =
        SpamdCodec.encode(Request.newRequest(Command.CHECK, Headers.of("User", "alice"), TWELVE));
    assertEquals(
        "CHECK SPAMC/1.5\r\nContent-length: 12\r\nUser: alice\r\n\r\nSubject: x\r\n", ascii(wire));
  }

  @Test
  public void explicitContentLengthKeepsCallerCasing() {
    val lower =
        ascii(
            SpamdCodec.encode(
                Request.newRequest(Command.CHECK, Headers.of("Content-length", "12"), TWELVE)));
    val upper =
        ascii(
            SpamdCodec.encode(
                Request.newRequest(Command.CHECK, Headers.of("CONTENT-LENGTH", "12"), TWELVE)));
    assertEquals(lower.replace("Content-length", "CONTENT-LENGTH"), upper);
    assertEquals(1, upper.split("(?i)content-length", -1).length - 1);
  }

  @Test
  public void wrongExplicitContentLengthFails() {
    val request = Request.newRequest(Command.CHECK, Headers.of("content-length", "99"), TWELVE);
    assertThrows(EncodeException.class, () -> SpamdCodec.encode(request));
    val twice =
        Request.newRequest(
            Command.CHECK, Headers.of("Content-length", "12", "content-length", "12"), TWELVE);
    assertThrows(EncodeException.class, () -> SpamdCodec.encode(twice));
  }

  @Test
  public void versionIsCarriedOnTheRequestLine() {
    val r = Request.builder().command(Command.PING).protocolVersion("1.2").build();
    assertTrue(ascii(SpamdCodec.encode(r)).startsWith("PING SPAMC/1.2\r\n"));
  }

  @Test
  public void compressedRequestDeclaresCompressedLength() throws Exception {
    val body = "A".repeat(4000).getBytes(StandardCharsets.US_ASCII);
    val r = Request.builder().command(Command.CHECK).body(body).compress(true).build();
    val wire = SpamdCodec.encode(r);
    val text = ascii(wire);
    val headerEnd = text.indexOf("\r\n\r\n") + 4;
    val compressed = new byte[wire.length - headerEnd];
    System.arraycopy(wire, headerEnd, compressed, 0, compressed.length);
    assertTrue(text.contains("Content-length: " + compressed.length + "\r\n"));
    assertTrue(text.contains("Compress: zlib\r\n"));
    assertTrue(compressed.length < body.length);
    assertArrayEquals(body, new ZlibCompression().decompress(compressed));
  }

  @Test
  public void compressHeaderWithoutCompressionFails() {
    val r = Request.newRequest(Command.CHECK, Headers.of("Compress", "zlib"), TWELVE);
    assertThrows(EncodeException.class, () -> SpamdCodec.encode(r));
  }

  @Test
  public void unknownCompressionFails() {
    val r =
        Request.builder()
            .command(Command.CHECK)
            .headers(Headers.of("Compress", "brotli"))
            .body(TWELVE)
            .compress(true)
            .build();
    assertThrows(EncodeException.class, () -> SpamdCodec.encode(r));
  }

  @Test
  public void responseEncodingMatchesDaemonFraming() {
    val resp =
        Response.builder()
            .protocolVersion("1.5")
            .statusCode(0)
            .statusMessage("EX_OK")
            .headers(Headers.of("Spam", "True ; 6.5 / 5.0"))
            .body("BAYES_99".getBytes(StandardCharsets.US_ASCII))
            .build();
    assertEquals(
        "SPAMD/1.5 0 EX_OK\r\nContent-length: 8\r\nSpam: True ; 6.5 / 5.0\r\n\r\nBAYES_99",
        ascii(SpamdCodec.encode(resp)));
  }

  @Test
  public void responseRoundTrip() throws Exception {
    val resp =
        Response.builder()
            .protocolVersion("1.5")
            .statusCode(0)
            .statusMessage("EX_OK")
            .headers(Headers.of("Content-length", "5", "Spam", "False ; 1.0 / 5.0"))
            .body("hello".getBytes(StandardCharsets.US_ASCII))
            .build();
    assertEquals(resp, ResponseDecoder.decode(SpamdCodec.encode(resp)));
  }
}
