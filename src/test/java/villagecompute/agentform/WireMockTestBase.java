package villagecompute.agentform;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Abstract base class for tests that deliver to HTTP endpoints.
 *
 * <p>
 * Starts a WireMock server on a random port before each test and stops it afterwards. Subclasses stub the receiving
 * side of an integration (customer webhook, Slack incoming webhook, CRM endpoint) and point the integration config at
 * {@link #url(String)}.
 */
public abstract class WireMockTestBase {

    /** WireMock HTTP server standing in for the integration endpoint. */
    protected WireMockServer wireMockServer;

    @BeforeEach
    protected void startWireMock() {
        // Random port to avoid conflicts between test classes
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        WireMock.configureFor("localhost", wireMockServer.port());
    }

    @AfterEach
    protected void stopWireMock() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.resetAll();
            wireMockServer.stop();
        }
    }

    protected String url(String path) {
        return "http://localhost:" + wireMockServer.port() + path;
    }

    /**
     * Stubs {@code POST path} to answer with {@code status} and an empty JSON body.
     */
    protected void stubPost(String path, int status) {
        stubPost(path, status, "{}");
    }

    protected void stubPost(String path, int status, String responseBodyJson) {
        wireMockServer.stubFor(WireMock.post(WireMock.urlPathEqualTo(path)).willReturn(WireMock.aResponse()
                .withStatus(status).withHeader("Content-Type", "application/json").withBody(responseBodyJson)));
    }

    /**
     * Stubs a CRM endpoint that acknowledges the record with an id.
     *
     * <p>
     * Uses the stub file: wiremock/crm/record-created.json
     */
    protected void stubCrmRecordCreated(String path) {
        stubPost(path, 201, loadStubFile("wiremock/crm/record-created.json"));
    }

    /**
     * Loads a stub file from test resources.
     *
     * @throws RuntimeException
     *             if the file is missing or unreadable
     */
    protected String loadStubFile(String resourcePath) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new RuntimeException("Stub file not found in test resources: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load stub file: " + resourcePath, e);
        }
    }
}
