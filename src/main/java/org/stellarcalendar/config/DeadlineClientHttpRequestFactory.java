package org.stellarcalendar.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.core5.concurrent.Cancellable;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.AbstractClientHttpRequest;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Request factory that aborts an exchange once it has run longer than the deadline, counted from request
 * creation until the response is closed. Socket timeouts alone only bound the gap between two reads.
 */
@Slf4j
public class DeadlineClientHttpRequestFactory extends HttpComponentsClientHttpRequestFactory {

    private final Duration deadline;
    private final ScheduledThreadPoolExecutor timer;
    private final ThreadLocal<Cancellable> lastCreated = new ThreadLocal<>();

    public DeadlineClientHttpRequestFactory(HttpClient httpClient, Duration deadline) {
        super(httpClient);
        this.deadline = deadline;
        this.timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "federation-http-deadline");
            thread.setDaemon(true);
            return thread;
        });
        this.timer.setRemoveOnCancelPolicy(true);
    }

    @Override
    protected void postProcessHttpRequest(ClassicHttpRequest request) {
        if (request instanceof Cancellable cancellable) {
            lastCreated.set(cancellable);
        }
    }

    @Override
    public ClientHttpRequest createRequest(URI uri, HttpMethod httpMethod) throws IOException {
        ClientHttpRequest request;
        Cancellable cancellable;
        try {
            request = super.createRequest(uri, httpMethod);
        } finally {
            cancellable = lastCreated.get();
            lastCreated.remove();
        }
        if (cancellable == null) {
            return request;
        }
        ScheduledFuture<?> abort = timer.schedule(() -> {
            log.warn("Aborting {} {} after {}", httpMethod, uri, deadline);
            cancellable.cancel();
        }, deadline.toMillis(), TimeUnit.MILLISECONDS);
        return new DeadlineRequest(request, abort);
    }

    /**
     * Number of exchanges whose deadline is still armed.
     */
    int pendingDeadlines() {
        return timer.getQueue().size();
    }

    @Override
    public void destroy() throws Exception {
        timer.shutdownNow();
        super.destroy();
    }

    /**
     * Passes through to the pooled request and disarms the deadline when execution fails.
     */
    private static final class DeadlineRequest extends AbstractClientHttpRequest {

        private final ClientHttpRequest delegate;
        private final ScheduledFuture<?> abort;

        DeadlineRequest(ClientHttpRequest delegate, ScheduledFuture<?> abort) {
            this.delegate = delegate;
            this.abort = abort;
        }

        @Override
        public HttpMethod getMethod() {
            return delegate.getMethod();
        }

        @Override
        public URI getURI() {
            return delegate.getURI();
        }

        @Override
        protected OutputStream getBodyInternal(HttpHeaders headers) throws IOException {
            return delegate.getBody();
        }

        @Override
        protected ClientHttpResponse executeInternal(HttpHeaders headers) throws IOException {
            delegate.getHeaders().putAll(headers);
            try {
                return new DeadlineResponse(delegate.execute(), abort);
            } catch (IOException | RuntimeException e) {
                abort.cancel(false);
                throw e;
            }
        }
    }

    /**
     * Disarms the deadline when the response is closed, whether or not the body was read.
     */
    private static final class DeadlineResponse implements ClientHttpResponse {

        private final ClientHttpResponse delegate;
        private final ScheduledFuture<?> abort;

        DeadlineResponse(ClientHttpResponse delegate, ScheduledFuture<?> abort) {
            this.delegate = delegate;
            this.abort = abort;
        }

        @Override
        public HttpStatusCode getStatusCode() throws IOException {
            return delegate.getStatusCode();
        }

        @Override
        public String getStatusText() throws IOException {
            return delegate.getStatusText();
        }

        @Override
        public HttpHeaders getHeaders() {
            return delegate.getHeaders();
        }

        @Override
        public InputStream getBody() throws IOException {
            return delegate.getBody();
        }

        @Override
        public void close() {
            try {
                delegate.close();
            } finally {
                abort.cancel(false);
            }
        }
    }
}
