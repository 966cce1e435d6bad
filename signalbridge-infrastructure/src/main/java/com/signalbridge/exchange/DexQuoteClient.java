package com.signalbridge.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalbridge.application.config.ConfigKey;
import com.signalbridge.application.ports.ConfigPort;
import com.signalbridge.application.ports.SwapAggregatorPort;
import com.signalbridge.domain.ErrorKind;
import com.signalbridge.domain.swap.AssembledTransaction;
import com.signalbridge.domain.swap.Quote;
import com.signalbridge.domain.swap.QuoteRequest;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Odos-style smart-order-router client.
 *
 * Two phases: POST /sor/quote/v2 returns a path id, POST /sor/assemble turns it into an unsigned
 * transaction descriptor. Any non-2xx answer is a VENUE error carrying status and body.
 */
public class DexQuoteClient implements SwapAggregatorPort {

    public static final String QUOTE_PATH = "/sor/quote/v2";
    public static final String ASSEMBLE_PATH = "/sor/assemble";
    public static final String DEFAULT_BASE_URL = "https://api.odos.xyz";
    public static final String API_KEY_HEADER = "API-Key";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String baseUrl;
    private final String apiKey;
    private final VenueHttp http;
    private final ObjectMapper om;

    public DexQuoteClient(String baseUrl, String apiKey, OkHttpClient client) {
        String u = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
        this.baseUrl = u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.om = new ObjectMapper();
        this.http = new VenueHttp(client, om, "DEX", code -> ErrorKind.VENUE);
    }

    public static DexQuoteClient fromConfig(ConfigPort cfg) {
        int timeoutSeconds = cfg.getInt(ConfigKey.HTTP_TIMEOUT_SECONDS.key(), 30);
        return new DexQuoteClient(
                cfg.get(ConfigKey.DEX_BASE_URL.key(), DEFAULT_BASE_URL),
                cfg.getSecret(ConfigKey.ODOS_API_KEY.key()),
                VenueHttp.client(Duration.ofSeconds(timeoutSeconds))
        );
    }

    @Override
    public Quote quote(QuoteRequest request) {
        ObjectNode body = om.createObjectNode();
        body.put("chainId", request.chainId());

        ArrayNode inputs = body.putArray("inputTokens");
        inputs.addObject()
                .put("tokenAddress", request.tokenIn())
                .put("amount", request.amountIn().toString());

        ArrayNode outputs = body.putArray("outputTokens");
        outputs.addObject()
                .put("tokenAddress", request.tokenOut())
                .put("proportion", 1);

        body.put("slippageLimitPercent", request.slippageLimitPercent());
        body.put("userAddr", request.userAddress());

        JsonNode resp = post(QUOTE_PATH, body);

        JsonNode pathId = resp.path("pathId");
        if (!pathId.isTextual() || pathId.asText().isBlank()) {
            throw new VenueException(ErrorKind.DECODE, "DEX", 0, resp.toString(), "Quote response has no pathId");
        }

        JsonNode impact = resp.path("priceImpact");
        return new Quote(
                pathId.asText(),
                texts(resp.path("inValues")),
                texts(resp.path("outValues")),
                resp.path("gasEstimate").asDouble(0.0),
                impact.isNumber() ? impact.asDouble() : null
        );
    }

    @Override
    public AssembledTransaction assemble(String pathId, String userAddress, boolean simulate) {
        ObjectNode body = om.createObjectNode();
        body.put("userAddr", userAddress);
        body.put("pathId", pathId);
        body.put("simulate", simulate);

        JsonNode resp = post(ASSEMBLE_PATH, body);

        JsonNode tx = resp.path("transaction");
        if (!tx.isObject()) {
            throw new VenueException(ErrorKind.DECODE, "DEX", 0, resp.toString(), "Assemble response has no transaction");
        }
        return AssembledTransaction.unsigned(
                tx.path("to").asText(null),
                tx.path("value").asText("0"),
                tx.path("gas").asLong(0L),
                tx.path("data").asText(null),
                simulate
        );
    }

    private JsonNode post(String path, ObjectNode body) {
        String json;
        try {
            json = om.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize DEX request", e);
        }

        Request.Builder rb = new Request.Builder()
                .url(baseUrl + path)
                .post(RequestBody.create(json, JSON));
        if (!apiKey.isBlank()) {
            rb.header(API_KEY_HEADER, apiKey);
        }
        return http.execute(rb.build());
    }

    private static List<String> texts(JsonNode arr) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : arr) out.add(n.asText());
        return out;
    }
}
