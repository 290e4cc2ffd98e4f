package org.profd.cli.commands.session;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Talks to the session API of a running daemon.
 */
public class SessionApiClient {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;
    private final String baseUrl;

    /**
     * @param host The daemon's HTTP host.
     * @param port The daemon's HTTP port.
     */
    public SessionApiClient(final String host, final int port) {
        this.client = HttpClient.newBuilder().connectTimeout(TIMEOUT).build();
        this.baseUrl = String.format("http://%s:%d/api/session/", host, port);
    }

    public HttpResponse<String> get(final String path) throws IOException, InterruptedException {
        return client.send(request(path).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    public HttpResponse<String> post(final String path, final byte[] body) throws IOException, InterruptedException {
        final HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(body);
        return client.send(request(path).POST(publisher).build(), HttpResponse.BodyHandlers.ofString());
    }

    String url(final String path) {
        return baseUrl + path;
    }

    private HttpRequest.Builder request(final String path) {
        return HttpRequest.newBuilder().uri(URI.create(url(path))).timeout(TIMEOUT);
    }
}
