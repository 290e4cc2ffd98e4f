package org.profd.node;

import com.google.protobuf.ByteString;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import io.restassured.RestAssured;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.extension.ExtendWith;
import org.profd.api.contracts.ProfilingConfig;
import org.profd.api.contracts.SampleRecord;
import org.profd.engine.ProtobufArtifact;
import org.profd.engine.RoundBasedSamplingEngine;
import org.profd.junit.extensions.logging.AllowLog;
import org.profd.junit.extensions.logging.LogLevel;
import org.profd.junit.extensions.logging.LogWatchExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.startsWith;

@Tag("integration")
@DisplayName("Node Session API Integration Test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.WARN, loggerPattern = ".*SessionHttpController")
class NodeIntegrationTest {

    private static final String BASE_PATH = "/api/session";

    private Path workDir;
    private Node node;

    @BeforeAll
    void startNode() throws Exception {
        workDir = Files.createTempDirectory("profd-node-test");
        final Config config = ConfigFactory.parseString("node.http.port = 0\nprofd.queue.type = memory")
            .withValue("profd.session.defaults.destination-directory", ConfigValueFactory.fromAnyRef(workDir.toString()))
            .withValue("profd.session.defaults.send-to-telemetry-queue", ConfigValueFactory.fromAnyRef(false))
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();

        node = new Node(config, new RoundBasedSamplingEngine((cfg, iteration, token) ->
            Optional.of(new ProtobufArtifact(SampleRecord.newBuilder()
                .setIteration(iteration)
                .setPerfData(ByteString.copyFromUtf8("round-" + iteration))
                .build()))));
        node.start();

        RestAssured.baseURI = "http://127.0.0.1";
        RestAssured.port = node.httpPort();
    }

    @AfterAll
    void stopNode() {
        if (node != null) {
            node.stop();
        }
    }

    @BeforeEach
    void waitForIdle() {
        node.getSessionController().stopIfRunning();
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
            given().get(BASE_PATH + "/status").then().body("state", equalTo("IDLE")));
    }

    @Test
    @DisplayName("GET /status - reports defaults while idle")
    void getStatus_initially_returnsIdle() {
        given()
            .when()
                .get(BASE_PATH + "/status")
            .then()
                .statusCode(200)
                .body("state", equalTo("IDLE"))
                .body("configuration.sampleDurationSeconds", equalTo(2));
    }

    @Test
    @DisplayName("POST /start, /stop - full lifecycle with conflict handling")
    void startAndStop_lifecycle() {
        given().queryParam("duration", 1).queryParam("interval", 3600).queryParam("iterations", 0)
            .when().post(BASE_PATH + "/start")
            .then().statusCode(202);

        given().queryParam("duration", 5).queryParam("interval", 5).queryParam("iterations", 5)
            .when().post(BASE_PATH + "/start")
            .then().statusCode(409).body("status", equalTo(409));

        given().get(BASE_PATH + "/status").then()
            .body("state", equalTo("RUNNING"))
            .body("configuration.collectionIntervalSeconds", equalTo(3600));

        given().post(BASE_PATH + "/stop").then().statusCode(202);
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
            given().get(BASE_PATH + "/status").then().body("state", equalTo("IDLE")));

        given().post(BASE_PATH + "/stop").then().statusCode(409);
    }

    @Test
    @DisplayName("POST /start - rejects malformed parameters")
    void start_withBadParameters_returns400() {
        given().queryParam("duration", "ten").queryParam("interval", 1).queryParam("iterations", 1)
            .when().post(BASE_PATH + "/start")
            .then().statusCode(400);
    }

    @Test
    @DisplayName("POST /start-proto - runs a structured session to completion")
    void startProto_runsToCompletion() {
        final Path destination = workDir.resolve("structured");
        final byte[] blob = ProfilingConfig.newBuilder()
            .setMainLoopIterations(2)
            .setCollectionIntervalInS(0)
            .setDestinationDirectory(destination.toString())
            .build()
            .toByteArray();

        given().contentType("application/octet-stream").body(blob)
            .when().post(BASE_PATH + "/start-proto")
            .then().statusCode(202);

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
            given().get(BASE_PATH + "/status").then()
                .body("state", equalTo("IDLE"))
                .body("lastOutcome", equalTo("SUCCESS")));
        assertThat(destination.resolve("perf.data.encoded.0")).exists();
        assertThat(destination.resolve("perf.data.encoded.1")).exists();
    }

    @Test
    @DisplayName("POST /start-proto - rejects malformed configuration")
    void startProto_malformed_returns400() {
        given().contentType("application/octet-stream").body(new byte[]{(byte) 0xFF})
            .when().post(BASE_PATH + "/start-proto")
            .then().statusCode(400).body("message", startsWith("Malformed profiling configuration"));

        given().get(BASE_PATH + "/status").then().body("state", equalTo("IDLE"));
    }

    @Test
    @DisplayName("GET /dump and POST /shell - diagnostic surfaces")
    void dumpAndShell() {
        given().get(BASE_PATH + "/dump").then()
            .statusCode(200)
            .contentType(containsString("text/plain"))
            .body(containsString("state: IDLE"));

        given().queryParam("arg", "stopProfiling")
            .when().post(BASE_PATH + "/shell")
            .then().statusCode(200).body("exitCode", equalTo(1));

        given().queryParam("arg", "startProfiling", "1", "3600", "0")
            .when().post(BASE_PATH + "/shell")
            .then().statusCode(200).body("exitCode", equalTo(0));

        given().get(BASE_PATH + "/status").then().body("state", equalTo("RUNNING"));
    }
}
