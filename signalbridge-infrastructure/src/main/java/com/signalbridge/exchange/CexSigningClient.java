package com.signalbridge.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbridge.application.config.ConfigKey;
import com.signalbridge.application.ports.ConfigPort;
import com.signalbridge.domain.DomainException;
import com.signalbridge.domain.ErrorKind;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Signed REST client for a Binance-compatible spot exchange.
 *
 * Signed calls:
 *  - parameters are percent-encoded and serialized in insertion order; the encoded query is what gets signed
 *  - {@code timestamp} (ms, from the injected clock) is appended, then {@code signature}
 *  - the API key travels in a header ({@code X-MBX-APIKEY} unless configured otherwise)
 *
 * Errors: 4xx -> AUTH, 5xx and transport -> NETWORK, bad JSON -> DECODE. No retries.
 */
public class CexSigningClient {

    private static final Logger log = LoggerFactory.getLogger(CexSigningClient.class);

    public static final String ACCOUNT = "/api/v3/account";
    public static final String EXCHANGE_INFO = "/api/v3/exchangeInfo";
    public static final String ORDER = "/api/v3/order";
    public static final String OPEN_ORDERS = "/api/v3/openOrders";
    public static final String ALL_ORDERS = "/api/v3/allOrders";

    public static final String DEFAULT_BASE_URL_TEST = "https://testnet.binance.vision";
    public static final String DEFAULT_BASE_URL_LIVE = "https://api.binance.com";
    public static final String DEFAULT_API_KEY_HEADER = "X-MBX-APIKEY";

    public static final int MAX_HISTORY_LIMIT = 1000;

    private static final BigDecimal EPSILON = new BigDecimal("1e-8");

    private final String baseUrl;
    private final String apiKey;
    private final String apiSecret;
    private final String apiKeyHeader;
    private final Clock clock;
    private final VenueHttp http;

    public CexSigningClient(String baseUrl, String apiKey, String apiSecret, String apiKeyHeader,
                            OkHttpClient client, Clock clock) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.apiSecret = apiSecret == null ? "" : apiSecret.trim();
        this.apiKeyHeader = (apiKeyHeader == null || apiKeyHeader.isBlank()) ? DEFAULT_API_KEY_HEADER : apiKeyHeader.trim();
        this.clock = clock;
        this.http = new VenueHttp(client, new ObjectMapper(), "CEX", CexSigningClient::classifyStatus);
    }

    public static CexSigningClient fromConfig(ConfigPort cfg, Clock clock) {
        String mode = cfg.get(ConfigKey.CEX_MODE.key(), "TEST").trim().toUpperCase(Locale.ROOT);
        boolean testMode = "TEST".equals(mode);

        String baseUrl = testMode
                ? cfg.get(ConfigKey.CEX_BASE_URL_TEST.key(), DEFAULT_BASE_URL_TEST).trim()
                : cfg.get(ConfigKey.CEX_BASE_URL_LIVE.key(), DEFAULT_BASE_URL_LIVE).trim();

        int timeoutSeconds = cfg.getInt(ConfigKey.HTTP_TIMEOUT_SECONDS.key(), 30);

        log.info("CEX mode: {}, baseUrl = {}", testMode ? "TEST" : "LIVE", baseUrl);

        return new CexSigningClient(
                baseUrl,
                cfg.getSecret(ConfigKey.CEX_API_KEY.key()),
                cfg.getSecret(ConfigKey.CEX_API_SECRET.key()),
                cfg.get(ConfigKey.CEX_API_KEY_HEADER.key(), DEFAULT_API_KEY_HEADER),
                VenueHttp.client(Duration.ofSeconds(timeoutSeconds)),
                clock
        );
    }

    static ErrorKind classifyStatus(int code) {
        return (code >= 400 && code < 500) ? ErrorKind.AUTH : ErrorKind.NETWORK;
    }

    public String baseUrl() {
        return baseUrl;
    }

    // --------------------------------------------------------------------
    //                              SIGNING
    // --------------------------------------------------------------------

    private void requireKeys() {
        if (apiKey.isBlank() || apiSecret.isBlank()) {
            throw new DomainException(ErrorKind.AUTH,
                    "Missing " + ConfigKey.CEX_API_KEY.key() + " / " + ConfigKey.CEX_API_SECRET.key());
        }
    }

    /**
     * Encodes {@code params} in iteration order, appends {@code timestamp} and signs the encoded query.
     */
    public SignedRequest sign(Map<String, String> params) {
        requireKeys();

        long ts = clock.millis();
        HttpUrl.Builder q = HttpUrl.get(baseUrl).newBuilder();
        for (Map.Entry<String, String> e : params.entrySet()) {
            q.addQueryParameter(e.getKey(), e.getValue());
        }
        q.addQueryParameter("timestamp", Long.toString(ts));

        String payload = q.build().encodedQuery();
        return new SignedRequest(payload, ts, Signer.hmacSha256(apiSecret, payload));
    }

    private HttpUrl signedUrl(String path, SignedRequest sr) {
        return HttpUrl.get(baseUrl + path).newBuilder()
                .encodedQuery(sr.queryString())
                .build();
    }

    private JsonNode signedGet(String path, Map<String, String> params) {
        SignedRequest sr = sign(params);
        return http.execute(new Request.Builder()
                .url(signedUrl(path, sr))
                .header(apiKeyHeader, apiKey)
                .get()
                .build());
    }

    private JsonNode signedPost(String path, Map<String, String> params) {
        SignedRequest sr = sign(params);
        // OkHttp 4.x: empty body must be created this way
        RequestBody emptyBody = RequestBody.create(new byte[0], null);
        return http.execute(new Request.Builder()
                .url(signedUrl(path, sr))
                .header(apiKeyHeader, apiKey)
                .post(emptyBody)
                .build());
    }

    private JsonNode signedDelete(String path, Map<String, String> params) {
        SignedRequest sr = sign(params);
        return http.execute(new Request.Builder()
                .url(signedUrl(path, sr))
                .header(apiKeyHeader, apiKey)
                .delete()
                .build());
    }

    private JsonNode publicGet(String path) {
        HttpUrl url = HttpUrl.get(baseUrl + path);
        return http.execute(new Request.Builder().url(url).get().build());
    }

    // --------------------------------------------------------------------
    //                         ACCOUNT / MARKET INFO
    // --------------------------------------------------------------------

    public JsonNode accountInfo() {
        return signedGet(ACCOUNT, new LinkedHashMap<>());
    }

    /** Free balance of {@code asset}; zero when the account does not list it. */
    public BigDecimal getBalance(String asset) {
        String wanted = asset.trim().toUpperCase(Locale.ROOT);
        JsonNode balances = accountInfo().path("balances");
        for (JsonNode b : balances) {
            if (wanted.equals(b.path("asset").asText())) {
                return decimal(b.path("free"), "free");
            }
        }
        return BigDecimal.ZERO;
    }

    public JsonNode exchangeInfo() {
        return publicGet(EXCHANGE_INFO);
    }

    public JsonNode symbolInfo(String symbol) {
        String wanted = symbol.trim().toUpperCase(Locale.ROOT);
        for (JsonNode s : exchangeInfo().path("symbols")) {
            if (wanted.equals(s.path("symbol").asText())) return s;
        }
        throw new DomainException(ErrorKind.VALIDATION, "Symbol " + wanted + " not found");
    }

    // --------------------------------------------------------------------
    //                               ORDERS
    // --------------------------------------------------------------------

    public JsonNode marketBuy(String symbol, BigDecimal quantity) {
        return marketBuy(symbol, quantity, null);
    }

    public JsonNode marketBuyByQuote(String symbol, BigDecimal quoteOrderQty) {
        return marketBuy(symbol, null, quoteOrderQty);
    }

    private JsonNode marketBuy(String symbol, BigDecimal quantity, BigDecimal quoteOrderQty) {
        if (quantity == null && quoteOrderQty == null) {
            throw new IllegalArgumentException("Either quantity or quoteOrderQty must be specified");
        }
        Map<String, String> p = orderParams(symbol, "BUY", "MARKET");
        if (quantity != null) p.put("quantity", plain(quantity));
        if (quoteOrderQty != null) p.put("quoteOrderQty", plain(quoteOrderQty));

        JsonNode resp = signedPost(ORDER, p);
        log.info("Market BUY {} placed: {}", p.get("symbol"), resp.path("orderId").asText());
        return resp;
    }

    public JsonNode marketSell(String symbol, BigDecimal quantity) {
        Map<String, String> p = orderParams(symbol, "SELL", "MARKET");
        p.put("quantity", plain(quantity));

        JsonNode resp = signedPost(ORDER, p);
        log.info("Market SELL {} placed: {}", p.get("symbol"), resp.path("orderId").asText());
        return resp;
    }

    public JsonNode limitBuy(String symbol, BigDecimal quantity, BigDecimal price, TimeInForce tif) {
        return limitOrder(symbol, "BUY", quantity, price, tif);
    }

    public JsonNode limitSell(String symbol, BigDecimal quantity, BigDecimal price, TimeInForce tif) {
        return limitOrder(symbol, "SELL", quantity, price, tif);
    }

    private JsonNode limitOrder(String symbol, String side, BigDecimal quantity, BigDecimal price, TimeInForce tif) {
        Map<String, String> p = orderParams(symbol, side, "LIMIT");
        p.put("quantity", plain(quantity));
        p.put("price", plain(price));
        p.put("timeInForce", (tif == null ? TimeInForce.GTC : tif).name());

        JsonNode resp = signedPost(ORDER, p);
        log.info("Limit {} {} @ {} placed: {}", side, p.get("symbol"), p.get("price"), resp.path("orderId").asText());
        return resp;
    }

    public JsonNode cancelOrder(String symbol, Long orderId, String origClientOrderId) {
        JsonNode resp = signedDelete(ORDER, orderRef(symbol, orderId, origClientOrderId));
        log.info("Order cancelled: {}", symbol);
        return resp;
    }

    public JsonNode orderStatus(String symbol, Long orderId, String origClientOrderId) {
        return signedGet(ORDER, orderRef(symbol, orderId, origClientOrderId));
    }

    /** Open orders for one symbol, or for all symbols when {@code symbol} is null. */
    public JsonNode openOrders(String symbol) {
        Map<String, String> p = new LinkedHashMap<>();
        if (symbol != null && !symbol.isBlank()) p.put("symbol", symbol.trim().toUpperCase(Locale.ROOT));
        return signedGet(OPEN_ORDERS, p);
    }

    public JsonNode orderHistory(String symbol, int limit) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("symbol", symbol.trim().toUpperCase(Locale.ROOT));
        p.put("limit", String.valueOf(Math.min(limit, MAX_HISTORY_LIMIT)));
        return signedGet(ALL_ORDERS, p);
    }

    private static Map<String, String> orderParams(String symbol, String side, String type) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("symbol", symbol.trim().toUpperCase(Locale.ROOT));
        p.put("side", side);
        p.put("type", type);
        return p;
    }

    private static Map<String, String> orderRef(String symbol, Long orderId, String origClientOrderId) {
        boolean hasClientId = origClientOrderId != null && !origClientOrderId.isBlank();
        if (orderId == null && !hasClientId) {
            throw new IllegalArgumentException("Either orderId or origClientOrderId must be specified");
        }
        Map<String, String> p = new LinkedHashMap<>();
        p.put("symbol", symbol.trim().toUpperCase(Locale.ROOT));
        if (orderId != null) p.put("orderId", String.valueOf(orderId));
        if (hasClientId) p.put("origClientOrderId", origClientOrderId.trim());
        return p;
    }

    // --------------------------------------------------------------------
    //                          FILTER VALIDATION
    // --------------------------------------------------------------------

    /**
     * Checks quantity against LOT_SIZE and, when {@code price} is given, price against PRICE_FILTER.
     * Filters missing from the symbol are skipped.
     */
    public void validateOrderParams(String symbol, BigDecimal quantity, BigDecimal price) {
        Map<String, JsonNode> filters = new LinkedHashMap<>();
        for (JsonNode f : symbolInfo(symbol).path("filters")) {
            filters.put(f.path("filterType").asText(), f);
        }

        JsonNode lot = filters.get("LOT_SIZE");
        if (lot != null) {
            checkRange("LOT_SIZE", "Quantity", quantity,
                    decimal(lot.path("minQty"), "minQty"),
                    decimal(lot.path("maxQty"), "maxQty"),
                    decimal(lot.path("stepSize"), "stepSize"));
        }

        JsonNode pf = filters.get("PRICE_FILTER");
        if (price != null && pf != null) {
            checkRange("PRICE_FILTER", "Price", price,
                    decimal(pf.path("minPrice"), "minPrice"),
                    decimal(pf.path("maxPrice"), "maxPrice"),
                    decimal(pf.path("tickSize"), "tickSize"));
        }
    }

    private static void checkRange(String filter, String what, BigDecimal value,
                                   BigDecimal min, BigDecimal max, BigDecimal step) {
        if (value.compareTo(min) < 0) {
            throw new FilterValidationException(filter, what + " " + plain(value) + " is below minimum " + plain(min));
        }
        if (max.signum() > 0 && value.compareTo(max) > 0) {
            throw new FilterValidationException(filter, what + " " + plain(value) + " is above maximum " + plain(max));
        }
        if (step.signum() > 0) {
            BigDecimal remainder = value.subtract(min).remainder(step).abs();
            if (remainder.compareTo(EPSILON) > 0) {
                throw new FilterValidationException(filter,
                        what + " " + plain(value) + " does not match step " + plain(step));
            }
        }
    }

    // --------------------------------------------------------------------

    private static BigDecimal decimal(JsonNode node, String field) {
        if (node.isMissingNode() || node.isNull()) {
            throw new VenueException(ErrorKind.DECODE, "CEX", 0, null, "Missing field in CEX response: " + field);
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new VenueException(ErrorKind.DECODE, "CEX", "Invalid decimal for " + field + ": " + node.asText(), e);
        }
    }

    static String plain(BigDecimal v) {
        return v.stripTrailingZeros().toPlainString();
    }

    private static String stripTrailingSlash(String url) {
        String u = url == null ? "" : url.trim();
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }
}
