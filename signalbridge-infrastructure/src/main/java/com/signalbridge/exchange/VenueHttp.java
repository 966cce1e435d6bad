package com.signalbridge.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbridge.domain.ErrorKind;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.function.IntFunction;

/**
 * Thin wrapper around OkHttp: executes one call, decodes the JSON body and classifies failures.
 *
 * Transport errors are {@link ErrorKind#NETWORK}, unparseable bodies {@link ErrorKind#DECODE};
 * non-2xx statuses are classified by the venue-specific mapping. No retries.
 */
public final class VenueHttp {

    private final OkHttpClient client;
    private final ObjectMapper om;
    private final String venue;
    private final IntFunction<ErrorKind> statusKind;

    public VenueHttp(OkHttpClient client, ObjectMapper om, String venue, IntFunction<ErrorKind> statusKind) {
        this.client = client;
        this.om = om;
        this.venue = venue;
        this.statusKind = statusKind;
    }

    /** Blocking client with identical connect/read/write timeouts. */
    public static OkHttpClient client(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    public JsonNode execute(Request req) {
        String body;
        int code;
        try (Response resp = client.newCall(req).execute()) {
            ResponseBody rb = resp.body();
            body = rb != null ? rb.string() : "";
            code = resp.code();
        } catch (IOException e) {
            throw new VenueException(ErrorKind.NETWORK, venue,
                    venue + " request failed: " + req.method() + " " + req.url().encodedPath() + ": " + e.getMessage(), e);
        }

        if (code < 200 || code >= 300) {
            throw new VenueException(statusKind.apply(code), venue, code, body,
                    venue + " HTTP " + code + " => " + body);
        }

        if (body.isBlank()) return om.createObjectNode();
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new VenueException(ErrorKind.DECODE, venue,
                    "Failed to decode " + venue + " response: " + e.getOriginalMessage(), e);
        }
    }

    public ObjectMapper mapper() {
        return om;
    }
}
