package io.wafgate.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.wafgate.core.error.EngineIOException;
import io.wafgate.core.model.Endpoint;
import io.wafgate.core.model.Interruption;
import io.wafgate.core.model.RequestView;
import io.wafgate.core.pipeline.PipelineResult.Phase;
import io.wafgate.core.spi.BodyReadResult;
import io.wafgate.core.spi.Transaction;
import io.wafgate.core.spi.TransactionOptions;
import io.wafgate.core.testkit.TestInspectionEngine;
import io.wafgate.core.testkit.TestTransaction;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TransactionPipelineTest {

    private static final String FORM = "name=alice&comment=hello";

    private final TransactionPipeline pipeline = new TransactionPipeline();

    private ListAppender<ILoggingEvent> logAppender;
    private Logger pipelineLogger;

    @BeforeEach
    void setUp() {
        pipelineLogger = (Logger) LoggerFactory.getLogger(TransactionPipeline.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        pipelineLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        pipelineLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Nested
    @DisplayName("Phase feed")
    class PhaseFeed {

        @Test
        @DisplayName("Phases run in order and see the request as projected")
        void feedsEveryPhase() {
            TestInspectionEngine engine = TestInspectionEngine.allowAll();
            TestTransaction tx = (TestTransaction) engine.newTransaction();
            RequestView view = post("/submit?x=1")
                    .addHeader("Host", "shop.example")
                    .addHeader("X-Trace", "a")
                    .addHeader("Content-Type", "application/x-www-form-urlencoded")
                    .addHeader("X-Trace", "b")
                    .host("shop.example")
                    .body(body(FORM))
                    .build();

            PipelineResult result = pipeline.run(tx, view);

            assertThat(result.isInterrupted()).isFalse();
            assertThat(tx.events()).containsExactly("connection", "uri", "serverName", "headers", "bodyRead", "body");
            assertThat(tx.clientHost()).isEqualTo("203.0.113.7");
            assertThat(tx.clientPort()).isEqualTo(51234);
            assertThat(tx.serverHost()).isEqualTo("10.0.0.5");
            assertThat(tx.serverPort()).isEqualTo(8080);
            assertThat(tx.uri()).isEqualTo("/submit?x=1");
            assertThat(tx.method()).isEqualTo("POST");
            assertThat(tx.protocol()).isEqualTo("HTTP/1.1");
            assertThat(tx.serverName()).isEqualTo("shop.example");
            assertThat(tx.headers())
                    .containsExactly(
                            Map.entry("Host", "shop.example"),
                            Map.entry("X-Trace", "a"),
                            Map.entry("X-Trace", "b"),
                            Map.entry("Content-Type", "application/x-www-form-urlencoded"));
        }

        @Test
        @DisplayName("Unknown endpoints are fed as empty host and port 0")
        void unknownEndpoints() {
            TestTransaction tx = (TestTransaction) TestInspectionEngine.allowAll().newTransaction();
            RequestView view =
                    RequestView.builder().method("GET").uri("/").build();

            pipeline.run(tx, view);

            assertThat(tx.clientHost()).isEmpty();
            assertThat(tx.clientPort()).isZero();
            assertThat(tx.serverHost()).isEmpty();
            assertThat(tx.serverPort()).isZero();
        }

        @Test
        @DisplayName("Server name is not set when the request has no host")
        void noServerNameWithoutHost() {
            TestTransaction tx = (TestTransaction) TestInspectionEngine.allowAll().newTransaction();

            pipeline.run(tx, RequestView.builder().method("GET").uri("/").build());

            assertThat(tx.events()).doesNotContain("serverName");
            assertThat(tx.headerValues("Host")).isEmpty();
        }

        @Test
        @DisplayName("Host and Transfer-Encoding synthesized only when absent from the headers")
        void synthesizedHeaders() {
            TestTransaction tx = (TestTransaction) TestInspectionEngine.allowAll().newTransaction();
            RequestView view = post("/upload")
                    .host("api.example")
                    .transferEncoding("chunked")
                    .body(body("x"))
                    .build();

            pipeline.run(tx, view);

            assertThat(tx.headerValues("Host")).containsExactly("api.example");
            assertThat(tx.headerValues("Transfer-Encoding")).containsExactly("chunked");
        }

        @Test
        @DisplayName("Existing Host and Transfer-Encoding headers are not duplicated")
        void noDuplicateSynthesis() {
            TestTransaction tx = (TestTransaction) TestInspectionEngine.allowAll().newTransaction();
            RequestView view = post("/upload")
                    .addHeader("host", "api.example")
                    .addHeader("Transfer-Encoding", "chunked")
                    .host("api.example")
                    .transferEncoding("chunked")
                    .body(body("x"))
                    .build();

            pipeline.run(tx, view);

            assertThat(tx.headerValues("Host")).containsExactly("api.example");
            assertThat(tx.headerValues("Transfer-Encoding")).containsExactly("chunked");
        }
    }

    @Nested
    @DisplayName("Header phase")
    class HeaderPhase {

        @Test
        @DisplayName("Interruption ends the pipeline before any body byte is read")
        void headerInterruptionSkipsBody() throws IOException {
            TestInspectionEngine engine = TestInspectionEngine.builder()
                    .headerRule(tx -> tx.headerValues("User-Agent").contains("sqlmap") ? Interruption.deny(913100, 0) : null)
                    .build();
            TestTransaction tx = (TestTransaction) engine.newTransaction();
            InputStream body = body(FORM);
            RequestView view =
                    post("/submit").addHeader("User-Agent", "sqlmap").body(body).build();

            PipelineResult result = pipeline.run(tx, view);

            assertThat(result.isInterrupted()).isTrue();
            assertThat(result.phase()).isEqualTo(Phase.REQUEST_HEADERS);
            assertThat(result.interruption().ruleId()).isEqualTo(913100);
            assertThat(result.body()).isNull();
            assertThat(tx.events()).doesNotContain("bodyRead", "body");
            assertThat(body.available()).isEqualTo(FORM.length());
        }

        @Test
        void interruptionLoggedAtInfo() {
            TestInspectionEngine engine = TestInspectionEngine.builder()
                    .headerRule(tx -> Interruption.deny(913100, 0))
                    .build();

            pipeline.run(engine.newTransaction(), RequestView.builder().method("GET").uri("/admin").build());

            assertThat(logAppender.list)
                    .filteredOn(e -> e.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("Request interrupted: phase=REQUEST_HEADERS, action=deny, rule_id=913100,"
                            + " status=0, method=GET, uri=/admin");
        }

        @Test
        void faultPropagates() {
            TestInspectionEngine engine = TestInspectionEngine.builder()
                    .headerFault(new IllegalStateException("engine bug"))
                    .build();

            assertThatThrownBy(() -> pipeline.run(engine.newTransaction(), post("/").build()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("engine bug");
        }
    }

    @Nested
    @DisplayName("Body phase")
    class BodyPhase {

        @Test
        @DisplayName("Allowed body is replayed byte-for-byte")
        void replayInvariant() throws IOException {
            TestTransaction tx = (TestTransaction) TestInspectionEngine.allowAll().newTransaction();

            PipelineResult result = pipeline.run(tx, post("/submit").body(body(FORM)).build());

            assertThat(tx.bodyText()).isEqualTo(FORM);
            assertThat(new String(result.body().readAllBytes(), StandardCharsets.UTF_8))
                    .isEqualTo(FORM);
        }

        @Test
        @DisplayName("Body beyond the engine limit is still delivered downstream, in order")
        void replayBeyondLimit() throws IOException {
            TestInspectionEngine engine = TestInspectionEngine.builder().bodyLimit(5).build();
            TestTransaction tx = (TestTransaction) engine.newTransaction();

            PipelineResult result = pipeline.run(tx, post("/submit").body(body(FORM)).build());

            assertThat(tx.bodyText()).isEqualTo("name=");
            assertThat(new String(result.body().readAllBytes(), StandardCharsets.UTF_8))
                    .isEqualTo(FORM);
        }

        @Test
        @DisplayName("Body not accessible: original stream passed through untouched")
        void bodyNotAccessible() {
            TestInspectionEngine engine =
                    TestInspectionEngine.builder().bodyAccessible(false).build();
            TestTransaction tx = (TestTransaction) engine.newTransaction();
            InputStream original = body(FORM);

            PipelineResult result = pipeline.run(tx, post("/submit").body(original).build());

            assertThat(result.body()).isSameAs(original);
            assertThat(tx.events()).contains("body").doesNotContain("bodyRead");
        }

        @Test
        @DisplayName("Body not accessible: body-phase rules still run")
        void bodyNotAccessibleStillEvaluated() throws IOException {
            TestInspectionEngine engine = TestInspectionEngine.builder()
                    .bodyAccessible(false)
                    .argsRule(tx -> tx.uri().contains("debug=true") ? Interruption.deny(920100, 0) : null)
                    .build();
            InputStream original = body(FORM);

            PipelineResult result =
                    pipeline.run(engine.newTransaction(), post("/submit?debug=true").body(original).build());

            assertThat(result.isInterrupted()).isTrue();
            assertThat(result.phase()).isEqualTo(Phase.REQUEST_BODY);
            assertThat(original.available()).isEqualTo(FORM.length());
        }

        @Test
        @DisplayName("No body: nothing ingested, body phase still evaluated")
        void noBody() {
            TestTransaction tx = (TestTransaction) TestInspectionEngine.allowAll().newTransaction();

            PipelineResult result = pipeline.run(tx, RequestView.builder().method("GET").uri("/").build());

            assertThat(result.isInterrupted()).isFalse();
            assertThat(result.body()).isNull();
            assertThat(tx.events()).containsExactly("connection", "uri", "headers", "body");
        }

        @Test
        @DisplayName("Query-string injection on a bodiless GET is denied in the body phase")
        void queryArgumentsDeniedWithoutBody() {
            TestInspectionEngine engine = TestInspectionEngine.builder()
                    .argsRule(tx -> tx.uri().contains("1%20OR%201=1") ? Interruption.deny(942100, 0) : null)
                    .build();
            TestTransaction tx = (TestTransaction) engine.newTransaction();
            RequestView view = RequestView.builder()
                    .method("GET")
                    .uri("/?id=1%20OR%201=1")
                    .host("shop.example")
                    .build();

            PipelineResult result = pipeline.run(tx, view);

            assertThat(result.isInterrupted()).isTrue();
            assertThat(result.phase()).isEqualTo(Phase.REQUEST_BODY);
            assertThat(result.interruption().ruleId()).isEqualTo(942100);
            assertThat(tx.events()).containsExactly("connection", "uri", "serverName", "headers", "body");
        }

        @Test
        @DisplayName("Body rule sees an empty body when none was sent")
        void bodyRuleWithoutBody() {
            TestInspectionEngine engine = TestInspectionEngine.builder()
                    .bodyRule(text -> text.isEmpty() ? Interruption.deny(920180, 411) : null)
                    .build();

            PipelineResult result =
                    pipeline.run(engine.newTransaction(), RequestView.builder().method("POST").uri("/submit").build());

            assertThat(result.isInterrupted()).isTrue();
            assertThat(result.interruption().status()).isEqualTo(411);
        }

        @Test
        @DisplayName("Interruption while ingesting ends the pipeline without processing the body")
        void ingestionInterruption() {
            TestInspectionEngine engine = TestInspectionEngine.builder()
                    .bodyReadRule(text -> text.contains("alice") ? Interruption.deny(920400, 413) : null)
                    .build();
            TestTransaction tx = (TestTransaction) engine.newTransaction();

            PipelineResult result = pipeline.run(tx, post("/submit").body(body(FORM)).build());

            assertThat(result.phase()).isEqualTo(Phase.REQUEST_BODY);
            assertThat(result.interruption().status()).isEqualTo(413);
            assertThat(result.body()).isNull();
            assertThat(tx.events()).contains("bodyRead").doesNotContain("body");
        }

        @Test
        @DisplayName("Interruption from body processing ends the pipeline")
        void bodyInterruption() {
            TestInspectionEngine engine = TestInspectionEngine.builder()
                    .bodyRule(text -> text.contains("<script>") ? Interruption.deny(941100, 0) : null)
                    .build();

            PipelineResult result =
                    pipeline.run(engine.newTransaction(), post("/submit").body(body("comment=<script>")).build());

            assertThat(result.isInterrupted()).isTrue();
            assertThat(result.phase()).isEqualTo(Phase.REQUEST_BODY);
            assertThat(result.interruption().ruleId()).isEqualTo(941100);
        }

        @Test
        @DisplayName("I/O failure while ingesting becomes EngineIOException")
        void ioFailure() {
            TestInspectionEngine engine = TestInspectionEngine.builder()
                    .bodyReadFault(new IOException("disk full"))
                    .build();

            assertThatThrownBy(() -> pipeline.run(engine.newTransaction(), post("/").body(body(FORM)).build()))
                    .isInstanceOf(EngineIOException.class)
                    .hasRootCauseMessage("disk full");
        }

        @Test
        @DisplayName("Cancelled request fails body processing")
        void cancelledRequest() {
            TestInspectionEngine.ContextAware engine =
                    TestInspectionEngine.builder().buildContextAware();
            Transaction tx = engine.newTransaction(new TransactionOptions("req-1", () -> true));

            assertThatThrownBy(() -> pipeline.run(tx, post("/").body(body(FORM)).build()))
                    .isInstanceOf(EngineIOException.class)
                    .hasRootCauseMessage("request cancelled");
        }

        @Test
        @DisplayName("Mismatch between reported and consumed byte counts is logged")
        void byteCountMismatchWarns() {
            TestInspectionEngine engine = TestInspectionEngine.allowAll();
            TestTransaction delegate = (TestTransaction) engine.newTransaction();
            Transaction lying = new ForwardingTransaction(delegate) {
                @Override
                public BodyReadResult readRequestBodyFrom(InputStream in) throws IOException {
                    BodyReadResult real = super.readRequestBodyFrom(in);
                    return new BodyReadResult(null, real.bytesRead() + 1);
                }
            };

            pipeline.run(lying, post("/").body(body(FORM)).build());

            assertThat(logAppender.list)
                    .filteredOn(e -> e.getLevel() == Level.WARN)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("Engine reported 25 body bytes read but 24 were consumed: uri=/");
        }
    }

    /** Delegates every call; tests override what they need to distort. */
    private static class ForwardingTransaction implements Transaction {
        private final TestTransaction delegate;

        ForwardingTransaction(TestTransaction delegate) {
            this.delegate = delegate;
        }

        @Override
        public void processConnection(String clientHost, int clientPort, String serverHost, int serverPort) {
            delegate.processConnection(clientHost, clientPort, serverHost, serverPort);
        }

        @Override
        public void processUri(String uri, String method, String protocol) {
            delegate.processUri(uri, method, protocol);
        }

        @Override
        public void addRequestHeader(String name, String value) {
            delegate.addRequestHeader(name, value);
        }

        @Override
        public void setServerName(String host) {
            delegate.setServerName(host);
        }

        @Override
        public Optional<Interruption> processRequestHeaders() {
            return delegate.processRequestHeaders();
        }

        @Override
        public boolean isRequestBodyAccessible() {
            return delegate.isRequestBodyAccessible();
        }

        @Override
        public BodyReadResult readRequestBodyFrom(InputStream body) throws IOException {
            return delegate.readRequestBodyFrom(body);
        }

        @Override
        public InputStream requestBodyReader() {
            return delegate.requestBodyReader();
        }

        @Override
        public Optional<Interruption> processRequestBody() throws IOException {
            return delegate.processRequestBody();
        }

        @Override
        public boolean isRuleEngineOff() {
            return delegate.isRuleEngineOff();
        }

        @Override
        public void processLogging() {
            delegate.processLogging();
        }

        @Override
        public void close() throws IOException {
            delegate.close();
        }
    }

    private static RequestView.Builder post(String uri) {
        return RequestView.builder()
                .method("POST")
                .uri(uri)
                .protocol("HTTP/1.1")
                .remote(Endpoint.of("203.0.113.7", 51234))
                .local(Endpoint.of("10.0.0.5", 8080));
    }

    private static InputStream body(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
