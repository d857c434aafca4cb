package org.dxworks.pageframe.validator;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;

/**
 * Probes assets with HEAD requests, retrying with GET when the server does
 * not allow HEAD.
 */
public class HttpAssetProbe implements AssetProbe {

    private static final int METHOD_NOT_ALLOWED = 405;

    private final HttpClient client;

    public HttpAssetProbe() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public HttpAssetProbe(HttpClient client) {
        this.client = client;
    }

    @Override
    public AssetProbeResult probe(String url, Duration timeout) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return AssetProbeResult.unreachable("Invalid URL: " + e.getMessage());
        }

        try {
            int status = send(uri, "HEAD", timeout);
            if (status == METHOD_NOT_ALLOWED) {
                status = send(uri, "GET", timeout);
            }
            return AssetProbeResult.status(status);
        } catch (HttpTimeoutException e) {
            return AssetProbeResult.timedOut("Timed out after " + timeout.toMillis() + " ms");
        } catch (ConnectException | UnresolvedAddressException e) {
            return AssetProbeResult.unreachable("Unreachable: " + e.getMessage());
        } catch (IOException | IllegalArgumentException e) {
            return AssetProbeResult.failed(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AssetProbeResult.failed("Interrupted");
        }
    }

    private int send(URI uri, String method, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .method(method, HttpRequest.BodyPublishers.noBody())
                .timeout(timeout)
                .build();
        return client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    }
}
