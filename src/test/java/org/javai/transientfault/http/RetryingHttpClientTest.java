package org.javai.transientfault.http;

import com.sun.net.httpserver.HttpServer;
import org.javai.transientfault.CancellationToken;
import org.javai.transientfault.retry.RetryPolicy;
import org.javai.transientfault.strategy.FixedIntervalRetryStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryingHttpClientTest {

    private HttpServer server;
    private final AtomicInteger requests = new AtomicInteger();
    private final List<Integer> statuses = new CopyOnWriteArrayList<>();
    private RetryingHttpClient client;
    private URI uri;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/orders", exchange -> {
            int index = requests.getAndIncrement();
            int status = index < statuses.size() ? statuses.get(index) : 200;
            byte[] body = ("attempt " + (index + 1)).getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/orders");

        RetryPolicy policy = new RetryPolicy(new HttpStatusCodeErrorClassifier(),
                new FixedIntervalRetryStrategy(3, Duration.ZERO));
        client = new RetryingHttpClient(HttpClient.newHttpClient(), policy);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void send_retriesTransientStatusUntilSuccess() throws IOException {
        statuses.addAll(List.of(503, 502));

        HttpResponse<String> response = client.send(request(), HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("attempt 3");
        assertThat(requests.get()).isEqualTo(3);
    }

    @Test
    void send_nonTransientStatus_returnsResponseWithoutRetry() throws IOException {
        statuses.add(404);

        HttpResponse<String> response = client.send(request(), HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(requests.get()).isEqualTo(1);
    }

    @Test
    void send_exhausted_returnsLastResponse() throws IOException {
        statuses.addAll(List.of(503, 503, 503, 503, 503));

        HttpResponse<String> response = client.send(request(), HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.body()).isEqualTo("attempt 4");
        assertThat(requests.get()).isEqualTo(4);
    }

    @Test
    void sendAsync_retriesTransientStatusUntilSuccess() throws Exception {
        statuses.addAll(List.of(504, 503));

        HttpResponse<String> response = client.sendAsync(request(), HttpResponse.BodyHandlers.ofString())
                .get(10, TimeUnit.SECONDS);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(requests.get()).isEqualTo(3);
    }

    @Test
    void sendAsync_exhausted_returnsLastResponse() throws Exception {
        statuses.addAll(List.of(503, 503, 503, 503));

        HttpResponse<String> response = client.sendAsync(request(), HttpResponse.BodyHandlers.ofString(),
                CancellationToken.create()).get(10, TimeUnit.SECONDS);

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(requests.get()).isEqualTo(4);
    }

    @Test
    void send_connectionRefused_throwsAfterRetries() {
        server.stop(0);

        assertThatThrownBy(() -> client.send(request(), HttpResponse.BodyHandlers.ofString()))
                .isInstanceOf(IOException.class);
    }

    @Test
    void defaultRetryPolicy_usesHttpClassifierAndExponentialBackoff() {
        RetryPolicy policy = RetryingHttpClient.defaultRetryPolicy();

        assertThat(policy.errorClassifier()).isInstanceOf(HttpStatusCodeErrorClassifier.class);
        assertThat(policy.retryStrategy().getShouldRetryHandler().shouldRetry(3, null).retryAllowed()).isFalse();
    }

    private HttpRequest request() {
        return HttpRequest.newBuilder(uri).timeout(Duration.ofSeconds(5)).GET().build();
    }
}
