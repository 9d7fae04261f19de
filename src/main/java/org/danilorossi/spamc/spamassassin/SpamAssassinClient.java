package org.danilorossi.spamc.spamassassin;

import jakarta.mail.Message;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.spamc.codec.Compressions;
import org.danilorossi.spamc.db.JsonDb;
import org.danilorossi.spamc.error.DaemonException;
import org.danilorossi.spamc.error.MalformedHeaderException;
import org.danilorossi.spamc.error.SpamcException;
import org.danilorossi.spamc.helpers.FileSystemUtils;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.helpers.LogConfigurator;
import org.danilorossi.spamc.helpers.MailUtils;
import org.danilorossi.spamc.model.SpamdClientConfig;
import org.danilorossi.spamc.pool.BoundedConnectionPool;
import org.danilorossi.spamc.pool.ConnectionPool;
import org.danilorossi.spamc.protocol.ActionOption;
import org.danilorossi.spamc.protocol.Command;
import org.danilorossi.spamc.protocol.Headers;
import org.danilorossi.spamc.protocol.MessageClass;
import org.danilorossi.spamc.protocol.Request;
import org.danilorossi.spamc.protocol.Response;
import org.danilorossi.spamc.protocol.ScoreLine;
import org.danilorossi.spamc.transport.Endpoint;

/**
 * SpamAssassin (spamd) client implementing the SPAMC/1.5 commands.
 *
 * <p>Supported commands: CHECK, SYMBOLS, REPORT, REPORT_IFSPAM, PROCESS, HEADERS, PING, TELL. Each
 * accepts the raw RFC822 bytes, a String (encoded UTF-8) or a {@code jakarta.mail.Message}, and
 * optionally {@link CallOptions} overriding timeout, endpoint, user and compression.
 *
 * <p>Default endpoint: 127.0.0.1:783. The client is thread-safe; concurrent calls share a bounded
 * connection pool. Close it to release the pool and the async executor.
 */
@Log
public class SpamAssassinClient implements AutoCloseable {

  static {
    LogConfigurator.configLog(log);
  }

  @FunctionalInterface
  private interface ResponseMapper<T> {
    T map(Response response) throws SpamcException;
  }

  @Getter private final SpamdClientConfig config;
  @Getter private final Endpoint endpoint;
  @Getter private final SpamdDispatcher dispatcher;

  /**
   * @param config connection settings; defaults when null
   * @param endpoint overrides the endpoint derived from {@code config}
   * @param pool overrides the pool built from {@code config}
   * @param executor runs async exchanges; an internal daemon pool when null
   * @param compressions codec registry; zlib only when null
   */
  @Builder
  private SpamAssassinClient(
      final SpamdClientConfig config,
      final Endpoint endpoint,
      final ConnectionPool pool,
      final ExecutorService executor,
      final Compressions compressions) {
    this.config = config == null ? SpamdClientConfig.builder().build() : config;
    this.config.validate();
    this.endpoint = endpoint == null ? this.config.toEndpoint() : endpoint;
    val connectionPool =
        pool != null
            ? pool
            : BoundedConnectionPool.builder()
                .maxConnections(this.config.getMaxConnections())
                .policy(this.config.getPoolPolicy())
                .connectTimeout(Duration.ofMillis(this.config.getConnectTimeoutMillis()))
                .reuseConnections(this.config.isReuseConnections())
                .maxIdle(Duration.ofMillis(this.config.getMaxIdleMillis()))
                .build();
    this.dispatcher =
        SpamdDispatcher.builder()
            .pool(connectionPool)
            .compressions(compressions)
            .connectRetries(this.config.getConnectRetries())
            .retryBackoff(Duration.ofMillis(this.config.getRetryBackoffMillis()))
            .executor(executor)
            .build();
  }

  public static SpamAssassinClient newFromConfig(@NonNull final SpamdClientConfig config) {
    return SpamAssassinClient.builder().config(config).build();
  }

  /** Client built from the config saved in {@code spamc.json}, or from defaults without one. */
  public static SpamAssassinClient newFromStoredConfig() {
    try (val db = new JsonDb()) {
      val config = db.config().load();
      config.validate();
      LangUtils.debug(log, "Client config loaded from {}", FileSystemUtils.getClientConfigJson());
      return newFromConfig(config);
    }
  }

  // --------------------------------------------------------------------------------------------
  // CHECK
  // --------------------------------------------------------------------------------------------

  /** Fast spam check: verdict and scores come from the {@code Spam} header. */
  public CheckResult check(@NonNull final byte[] rfc822MessageBytes, @NonNull final CallOptions opt)
      throws SpamcException {
    return call(
        Command.CHECK,
        rfc822MessageBytes,
        opt,
        null,
        resp -> {
          val score = requireScore(resp);
          return CheckResult.builder()
              .isSpam(score.isSpam())
              .score(score.getScore())
              .threshold(score.getThreshold())
              .response(resp)
              .build();
        });
  }

  public CheckResult check(@NonNull final byte[] rfc822MessageBytes) throws SpamcException {
    return check(rfc822MessageBytes, CallOptions.DEFAULTS);
  }

  /** Prefer the byte[] of the original RFC822 message; the String is encoded UTF-8. */
  public CheckResult check(@NonNull final String rfc822Message) throws SpamcException {
    return check(utf8(rfc822Message));
  }

  public CheckResult check(@NonNull final String rfc822Message, @NonNull final CallOptions opt)
      throws SpamcException {
    return check(utf8(rfc822Message), opt);
  }

  public CheckResult check(@NonNull final Message message) throws IOException {
    return check(MailUtils.toRfc822Bytes(message));
  }

  public CheckResult check(@NonNull final Message message, @NonNull final CallOptions opt)
      throws IOException {
    return check(MailUtils.toRfc822Bytes(message), opt);
  }

  // --------------------------------------------------------------------------------------------
  // SYMBOLS
  // --------------------------------------------------------------------------------------------

  /** Check plus the comma-separated list of rules that matched. */
  public SymbolsResult symbols(
      @NonNull final byte[] rfc822MessageBytes, @NonNull final CallOptions opt)
      throws SpamcException {
    return call(
        Command.SYMBOLS,
        rfc822MessageBytes,
        opt,
        null,
        resp -> {
          val score = requireScore(resp);
          val raw = resp.hasBody() ? resp.bodyAsString() : "";
          return SymbolsResult.builder()
              .isSpam(score.isSpam())
              .score(score.getScore())
              .threshold(score.getThreshold())
              .symbols(parseSymbols(raw))
              .symbolsRaw(raw)
              .response(resp)
              .build();
        });
  }

  public SymbolsResult symbols(@NonNull final byte[] rfc822MessageBytes) throws SpamcException {
    return symbols(rfc822MessageBytes, CallOptions.DEFAULTS);
  }

  public SymbolsResult symbols(@NonNull final String rfc822Message) throws SpamcException {
    return symbols(utf8(rfc822Message));
  }

  public SymbolsResult symbols(@NonNull final String rfc822Message, @NonNull final CallOptions opt)
      throws SpamcException {
    return symbols(utf8(rfc822Message), opt);
  }

  public SymbolsResult symbols(@NonNull final Message message) throws IOException {
    return symbols(MailUtils.toRfc822Bytes(message));
  }

  public SymbolsResult symbols(@NonNull final Message message, @NonNull final CallOptions opt)
      throws IOException {
    return symbols(MailUtils.toRfc822Bytes(message), opt);
  }

  // --------------------------------------------------------------------------------------------
  // REPORT / REPORT_IFSPAM
  // --------------------------------------------------------------------------------------------

  public ReportResult report(
      @NonNull final byte[] rfc822MessageBytes, @NonNull final CallOptions opt)
      throws SpamcException {
    return call(Command.REPORT, rfc822MessageBytes, opt, null, SpamAssassinClient::toReport);
  }

  public ReportResult report(@NonNull final byte[] rfc822MessageBytes) throws SpamcException {
    return report(rfc822MessageBytes, CallOptions.DEFAULTS);
  }

  public ReportResult report(@NonNull final String rfc822Message) throws SpamcException {
    return report(utf8(rfc822Message));
  }

  public ReportResult report(@NonNull final String rfc822Message, @NonNull final CallOptions opt)
      throws SpamcException {
    return report(utf8(rfc822Message), opt);
  }

  public ReportResult report(@NonNull final Message message) throws IOException {
    return report(MailUtils.toRfc822Bytes(message));
  }

  public ReportResult report(@NonNull final Message message, @NonNull final CallOptions opt)
      throws IOException {
    return report(MailUtils.toRfc822Bytes(message), opt);
  }

  /** Like {@link #report(byte[], CallOptions)} but spamd only writes a report for spam. */
  public ReportResult reportIfSpam(
      @NonNull final byte[] rfc822MessageBytes, @NonNull final CallOptions opt)
      throws SpamcException {
    return call(
        Command.REPORT_IFSPAM, rfc822MessageBytes, opt, null, SpamAssassinClient::toReport);
  }

  public ReportResult reportIfSpam(@NonNull final byte[] rfc822MessageBytes)
      throws SpamcException {
    return reportIfSpam(rfc822MessageBytes, CallOptions.DEFAULTS);
  }

  public ReportResult reportIfSpam(@NonNull final String rfc822Message) throws SpamcException {
    return reportIfSpam(utf8(rfc822Message));
  }

  public ReportResult reportIfSpam(
      @NonNull final String rfc822Message, @NonNull final CallOptions opt) throws SpamcException {
    return reportIfSpam(utf8(rfc822Message), opt);
  }

  public ReportResult reportIfSpam(@NonNull final Message message) throws IOException {
    return reportIfSpam(MailUtils.toRfc822Bytes(message));
  }

  public ReportResult reportIfSpam(@NonNull final Message message, @NonNull final CallOptions opt)
      throws IOException {
    return reportIfSpam(MailUtils.toRfc822Bytes(message), opt);
  }

  // --------------------------------------------------------------------------------------------
  // PROCESS / HEADERS
  // --------------------------------------------------------------------------------------------

  /** The message as rewritten by spamd (markup headers, possibly wrapped report). */
  public ProcessResult process(
      @NonNull final byte[] rfc822MessageBytes, @NonNull final CallOptions opt)
      throws SpamcException {
    return call(Command.PROCESS, rfc822MessageBytes, opt, null, SpamAssassinClient::toProcess);
  }

  public ProcessResult process(@NonNull final byte[] rfc822MessageBytes) throws SpamcException {
    return process(rfc822MessageBytes, CallOptions.DEFAULTS);
  }

  public ProcessResult process(@NonNull final String rfc822Message) throws SpamcException {
    return process(utf8(rfc822Message));
  }

  public ProcessResult process(@NonNull final String rfc822Message, @NonNull final CallOptions opt)
      throws SpamcException {
    return process(utf8(rfc822Message), opt);
  }

  public ProcessResult process(@NonNull final Message message) throws IOException {
    return process(MailUtils.toRfc822Bytes(message));
  }

  public ProcessResult process(@NonNull final Message message, @NonNull final CallOptions opt)
      throws IOException {
    return process(MailUtils.toRfc822Bytes(message), opt);
  }

  /** Only the rewritten header block of the message. */
  public ProcessResult headers(
      @NonNull final byte[] rfc822MessageBytes, @NonNull final CallOptions opt)
      throws SpamcException {
    return call(Command.HEADERS, rfc822MessageBytes, opt, null, SpamAssassinClient::toProcess);
  }

  public ProcessResult headers(@NonNull final byte[] rfc822MessageBytes) throws SpamcException {
    return headers(rfc822MessageBytes, CallOptions.DEFAULTS);
  }

  public ProcessResult headers(@NonNull final String rfc822Message) throws SpamcException {
    return headers(utf8(rfc822Message));
  }

  public ProcessResult headers(@NonNull final String rfc822Message, @NonNull final CallOptions opt)
      throws SpamcException {
    return headers(utf8(rfc822Message), opt);
  }

  public ProcessResult headers(@NonNull final Message message) throws IOException {
    return headers(MailUtils.toRfc822Bytes(message));
  }

  public ProcessResult headers(@NonNull final Message message, @NonNull final CallOptions opt)
      throws IOException {
    return headers(MailUtils.toRfc822Bytes(message), opt);
  }

  // --------------------------------------------------------------------------------------------
  // PING
  // --------------------------------------------------------------------------------------------

  public PingResult ping(@NonNull final CallOptions opt) throws SpamcException {
    return call(
        Command.PING,
        null,
        opt,
        null,
        resp ->
            PingResult.builder()
                .version(resp.getProtocolVersion())
                .message(resp.getStatusMessage())
                .build());
  }

  public PingResult ping() throws SpamcException {
    return ping(CallOptions.DEFAULTS);
  }

  // --------------------------------------------------------------------------------------------
  // TELL
  // --------------------------------------------------------------------------------------------

  /**
   * Teaches spamd about a message.
   *
   * @param set databases to add the message to; null or NONE to skip
   * @param remove databases to remove the message from; null or NONE to skip
   */
  public TellResult tell(
      @NonNull final byte[] rfc822MessageBytes,
      @NonNull final MessageClass messageClass,
      final ActionOption set,
      final ActionOption remove,
      @NonNull final CallOptions opt)
      throws SpamcException {
    val extra = new Headers().add(Headers.MESSAGE_CLASS, messageClass.getToken());
    if (set != null && !set.isEmpty()) extra.add(Headers.SET, set.toHeaderValue());
    if (remove != null && !remove.isEmpty()) extra.add(Headers.REMOVE, remove.toHeaderValue());
    return call(
        Command.TELL,
        rfc822MessageBytes,
        opt,
        extra,
        resp ->
            TellResult.builder()
                .didSet(resp.getDidSet().orElse(ActionOption.NONE))
                .didRemove(resp.getDidRemove().orElse(ActionOption.NONE))
                .response(resp)
                .build());
  }

  public TellResult tell(
      @NonNull final byte[] rfc822MessageBytes,
      @NonNull final MessageClass messageClass,
      final ActionOption set,
      final ActionOption remove)
      throws SpamcException {
    return tell(rfc822MessageBytes, messageClass, set, remove, CallOptions.DEFAULTS);
  }

  public TellResult tell(
      @NonNull final String rfc822Message,
      @NonNull final MessageClass messageClass,
      final ActionOption set,
      final ActionOption remove)
      throws SpamcException {
    return tell(utf8(rfc822Message), messageClass, set, remove);
  }

  public TellResult tell(
      @NonNull final String rfc822Message,
      @NonNull final MessageClass messageClass,
      final ActionOption set,
      final ActionOption remove,
      @NonNull final CallOptions opt)
      throws SpamcException {
    return tell(utf8(rfc822Message), messageClass, set, remove, opt);
  }

  public TellResult tell(
      @NonNull final Message message,
      @NonNull final MessageClass messageClass,
      final ActionOption set,
      final ActionOption remove)
      throws IOException {
    return tell(MailUtils.toRfc822Bytes(message), messageClass, set, remove);
  }

  public TellResult tell(
      @NonNull final Message message,
      @NonNull final MessageClass messageClass,
      final ActionOption set,
      final ActionOption remove,
      @NonNull final CallOptions opt)
      throws IOException {
    return tell(MailUtils.toRfc822Bytes(message), messageClass, set, remove, opt);
  }

  // --------------------------------------------------------------------------------------------
  // Low-level protocol
  // --------------------------------------------------------------------------------------------

  /** Sends a prepared request; the response is returned whatever its status code. */
  public Response execute(@NonNull final Request request, @NonNull final CallOptions opt)
      throws SpamcException {
    return dispatcher.execute(request, endpointFor(opt), timeoutFor(opt));
  }

  public Response execute(@NonNull final Request request) throws SpamcException {
    return execute(request, CallOptions.DEFAULTS);
  }

  /** Async {@link #execute(Request, CallOptions)}; cancelling the future aborts the exchange. */
  public CompletableFuture<Response> executeAsync(
      @NonNull final Request request, @NonNull final CallOptions opt) {
    return dispatcher.executeAsync(request, endpointFor(opt), timeoutFor(opt));
  }

  public CompletableFuture<Response> executeAsync(@NonNull final Request request) {
    return executeAsync(request, CallOptions.DEFAULTS);
  }

  @Override
  public void close() {
    dispatcher.close();
  }

  private <T> T call(
      final Command command,
      final byte[] body,
      final CallOptions opt,
      final Headers extra,
      final ResponseMapper<T> mapper)
      throws SpamcException {
    val request = newRequest(command, body, opt, extra);
    val target = endpointFor(opt);
    val resp = dispatcher.execute(request, target, timeoutFor(opt));
    try {
      ensureOk(resp);
      return mapper.map(resp);
    } catch (SpamcException e) {
      throw e.attach(command, target);
    }
  }

  private Request newRequest(
      final Command command, final byte[] body, final CallOptions opt, final Headers extra) {
    val headers = new Headers();
    val user = opt.getUser() != null ? opt.getUser() : config.getUser();
    if (!LangUtils.empty(user)) headers.add(Headers.USER, user.trim());
    if (extra != null) for (val e : extra) headers.add(e.getName(), e.getValue());
    val compress = opt.getCompress() != null ? opt.getCompress() : config.isCompress();
    return Request.builder()
        .command(command)
        .protocolVersion(config.getProtocolVersion())
        .headers(headers)
        .body(body)
        .compress(compress && body != null)
        .build();
  }

  private Endpoint endpointFor(final CallOptions opt) {
    return opt.getEndpoint() != null ? opt.getEndpoint() : endpoint;
  }

  private Duration timeoutFor(final CallOptions opt) {
    if (opt.getTimeout() != null) {
      if (opt.getTimeout().isNegative() || opt.getTimeout().isZero())
        throw new IllegalArgumentException("Timeout must be positive: " + opt.getTimeout());
      return opt.getTimeout();
    }
    return Duration.ofMillis(config.exchangeTimeoutMillis());
  }

  private static void ensureOk(final Response r) throws DaemonException {
    if (!r.isOk()) {
      LangUtils.warn(log, "spamd returned non-OK: {} {}", r.getStatusCode(), r.getStatusMessage());
      throw new DaemonException(r);
    }
  }

  private static ScoreLine requireScore(final Response resp) throws MalformedHeaderException {
    return resp.getScore()
        .orElseThrow(() -> new MalformedHeaderException("Missing 'Spam' header in response"));
  }

  private static ReportResult toReport(final Response resp) throws SpamcException {
    val score = requireScore(resp);
    return ReportResult.builder()
        .isSpam(score.isSpam())
        .score(score.getScore())
        .threshold(score.getThreshold())
        .report(resp.hasBody() ? resp.bodyAsString() : "")
        .response(resp)
        .build();
  }

  private static ProcessResult toProcess(final Response resp) throws SpamcException {
    return ProcessResult.builder()
        .score(resp.getScore().orElse(null))
        .message(resp.hasBody() ? resp.getBody() : new byte[0])
        .response(resp)
        .build();
  }

  /** SYMBOLS body: {@code RULE_A,RULE_B,RULE_C}, possibly with spaces and a trailing newline. */
  static List<String> parseSymbols(final String raw) {
    if (LangUtils.empty(raw)) return Collections.emptyList();
    val out = new ArrayList<String>();
    for (val token : raw.split("[,\\s]+")) if (!token.isEmpty()) out.add(token);
    return Collections.unmodifiableList(out);
  }

  private static byte[] utf8(final String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
