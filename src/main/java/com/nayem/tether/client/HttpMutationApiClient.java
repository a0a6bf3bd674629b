package com.nayem.tether.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nayem.tether.core.CollapsedMutation;
import com.nayem.tether.core.MutationOperationCodec;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * OkHttp implementation posting collapsed mutations as JSON.
 *
 * <pre>
 * POST {baseUrl}/api/channels/mutations
 * X-Idempotency-Token: channel-1:42
 *
 * {"audience": {"channel_id": "channel-1"},
 *  "operations": [...],
 *  "idempotency_token": "channel-1:42"}
 * </pre>
 */
public class HttpMutationApiClient implements MutationApiClient {

    private static final Logger log = LoggerFactory.getLogger(HttpMutationApiClient.class);

    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String IDEMPOTENCY_HEADER = "X-Idempotency-Token";
    static final String APP_KEY_HEADER = "X-App-Key";

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final MutationOperationCodec codec;
    private final HttpUrl endpoint;
    private final AudienceType audienceType;
    private final String appKey;

    public HttpMutationApiClient(OkHttpClient client, ObjectMapper objectMapper, String baseUrl,
            AudienceType audienceType, String appKey) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalArgumentException("Invalid base URL: " + baseUrl);
        }
        this.client = client;
        this.objectMapper = objectMapper;
        this.codec = new MutationOperationCodec(objectMapper);
        this.endpoint = base.newBuilder().addPathSegments(audienceType.path()).build();
        this.audienceType = audienceType;
        this.appKey = appKey;
    }

    public static OkHttpClient defaultClient(Duration connectTimeout, Duration readTimeout, Duration callTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .callTimeout(callTimeout)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public SyncOutcome send(String identifier, CollapsedMutation mutation, CancellationToken cancellation) {
        if (mutation.isEmpty()) {
            return SyncOutcome.success(204);
        }
        if (cancellation.isCancelled()) {
            return SyncOutcome.retryable("cancelled before send", null);
        }

        String token = mutation.idempotencyToken(identifier);
        String body;
        try {
            body = objectMapper.writeValueAsString(requestBody(identifier, mutation, token));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize mutation for " + identifier, e);
        }

        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .header("Accept", "application/json")
                .header(IDEMPOTENCY_HEADER, token)
                .post(RequestBody.create(body, JSON));
        if (appKey != null && !appKey.isBlank()) {
            builder.header(APP_KEY_HEADER, appKey);
        }

        Call call = client.newCall(builder.build());
        cancellation.onCancel(call::cancel);

        log.debug("Posting {} operation(s) for {} to {}", mutation.operations().size(), identifier, endpoint);
        try (Response response = call.execute()) {
            log.debug("Mutation response for {}: {}", identifier, response.code());
            return classify(response.code(), response.message());
        } catch (IOException e) {
            if (cancellation.isCancelled() || call.isCanceled()) {
                return SyncOutcome.retryable("cancelled", null);
            }
            if (e instanceof InterruptedIOException) {
                return SyncOutcome.retryable("timeout: " + e.getMessage(), null);
            }
            log.debug("Transport error posting mutation for {}", identifier, e);
            return SyncOutcome.retryable("transport error: " + e.getMessage(), null);
        }
    }

    private ObjectNode requestBody(String identifier, CollapsedMutation mutation, String token) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("audience").put(audienceType.audienceKey(), identifier);
        root.set("operations", codec.toJson(mutation.operations()));
        root.put("idempotency_token", token);
        return root;
    }

    static SyncOutcome classify(int status, String message) {
        String reason = status + (message == null || message.isEmpty() ? "" : " " + message);
        if (status >= 200 && status < 300) {
            return SyncOutcome.success(status);
        }
        if (status == 429 || status >= 500) {
            return SyncOutcome.retryable(reason, status);
        }
        if (status >= 400) {
            return SyncOutcome.unrecoverable(reason, status);
        }
        return SyncOutcome.retryable("unexpected status " + reason, status);
    }
}
