package me.golemcore.scout.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * Never performs network I/O. Tests enqueue responses or failures and read
 * back the captured requests.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Request> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public void enqueueJson(int code, String body) {
        plannedResults.add(new PlannedResult(code, body != null ? body : "", null));
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(new PlannedResult(0, "", failure));
    }

    public Request takeRequest() {
        return capturedRequests.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        capturedRequests.add(request);
        requestCount.incrementAndGet();

        PlannedResult planned = plannedResults.poll();
        if (planned == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (planned.failure() != null) {
            throw planned.failure();
        }

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(planned.code())
                .message("mock")
                .headers(Headers.of())
                .body(ResponseBody.create(planned.body().getBytes(StandardCharsets.UTF_8), JSON))
                .build();
    }

    private record PlannedResult(int code, String body, IOException failure) {
    }
}
