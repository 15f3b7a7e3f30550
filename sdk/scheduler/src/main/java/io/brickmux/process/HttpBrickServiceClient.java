package io.brickmux.process;

import io.brickmux.brick.BrickId;
import io.brickmux.config.SerializationUtils;
import io.brickmux.util.LoggingUtils;

import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.StatusLine;
import org.apache.http.client.fluent.Executor;
import org.apache.http.client.fluent.Request;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.HttpClientBuilder;
import org.slf4j.Logger;

import java.io.IOException;
import java.time.Duration;

/**
 * {@link BrickServiceClient} which talks to brick-server processes over HTTP on their listening port:
 * {@code POST http://127.0.0.1:<port>/v1/services/attach} and {@code .../v1/services/detach}, each with the brick as
 * a JSON body. {@code 200} means success, {@code 409} or {@code 503} mean the process refused.
 */
public class HttpBrickServiceClient implements BrickServiceClient {

    private static final Logger LOGGER = LoggingUtils.getLogger(HttpBrickServiceClient.class);

    private static final String ATTACH_PATH = "/v1/services/attach";
    private static final String DETACH_PATH = "/v1/services/detach";

    private final Executor executor;
    private final String host;
    private final int timeoutMs;

    public HttpBrickServiceClient(Duration timeout) {
        this("127.0.0.1", timeout);
    }

    public HttpBrickServiceClient(String host, Duration timeout) {
        this.executor = Executor.newInstance(HttpClientBuilder.create().disableAutomaticRetries().build());
        this.host = host;
        this.timeoutMs = (int) timeout.toMillis();
    }

    @Override
    public void attach(int port, BrickId brick) throws IOException {
        StatusLine status = post(port, ATTACH_PATH, brick);
        switch (status.getStatusCode()) {
        case HttpStatus.SC_OK:
            return;
        case HttpStatus.SC_CONFLICT:
        case HttpStatus.SC_SERVICE_UNAVAILABLE:
            throw new AttachRejectedException(status.getStatusCode(), String.format(
                    "Process on port %d rejected brick %s: %s", port, brick, status.getReasonPhrase()));
        default:
            throw new IOException(String.format(
                    "Unable to attach brick %s to process on port %d: code=%d, reason='%s'",
                    brick, port, status.getStatusCode(), status.getReasonPhrase()));
        }
    }

    @Override
    public void detach(int port, BrickId brick) throws IOException {
        StatusLine status = post(port, DETACH_PATH, brick);
        if (status.getStatusCode() != HttpStatus.SC_OK) {
            throw new IOException(String.format(
                    "Unable to detach brick %s from process on port %d: code=%d, reason='%s'",
                    brick, port, status.getStatusCode(), status.getReasonPhrase()));
        }
    }

    private StatusLine post(int port, String path, BrickId brick) throws IOException {
        String url = String.format("http://%s:%d%s", host, port, path);
        LOGGER.debug("POST {} {}", url, brick);
        Request request = Request.Post(url)
                .connectTimeout(timeoutMs)
                .socketTimeout(timeoutMs)
                .bodyString(SerializationUtils.toJsonString(brick), ContentType.APPLICATION_JSON);
        HttpResponse response = executor.execute(request).returnResponse();
        return response.getStatusLine();
    }
}
