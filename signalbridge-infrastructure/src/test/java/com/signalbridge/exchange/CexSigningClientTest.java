package com.signalbridge.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalbridge.domain.DomainException;
import com.signalbridge.domain.ErrorKind;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CexSigningClientTest {

    private static final long TS = 1499827319559L;

    private static final String EXCHANGE_INFO = "{\"symbols\":[{\"symbol\":\"ETHUSDT\",\"filters\":["
            + "{\"filterType\":\"PRICE_FILTER\",\"minPrice\":\"0.01\",\"maxPrice\":\"1000000\",\"tickSize\":\"0.01\"},"
            + "{\"filterType\":\"LOT_SIZE\",\"minQty\":\"0.0001\",\"maxQty\":\"9000\",\"stepSize\":\"0.0001\"}"
            + "]}]}";

    private MockWebServer server;
    private CexSigningClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = newClient("key-1", SignerTest.SECRET);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private CexSigningClient newClient(String key, String secret) {
        OkHttpClient http = VenueHttp.client(Duration.ofSeconds(5));
        return new CexSigningClient(server.url("/").toString(), key, secret, null, http,
                Clock.fixed(Instant.ofEpochMilli(TS), ZoneOffset.UTC));
    }

    @Test
    void signsParametersInInsertionOrder() {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("symbol", "LTCBTC");
        p.put("side", "BUY");
        p.put("type", "LIMIT");
        p.put("timeInForce", "GTC");
        p.put("quantity", "1");
        p.put("price", "0.1");
        p.put("recvWindow", "5000");

        SignedRequest sr = client.sign(p);

        assertThat(sr.payload()).isEqualTo(SignerTest.QUERY);
        assertThat(sr.timestamp()).isEqualTo(TS);
        assertThat(sr.signature()).isEqualTo(SignerTest.SIGNATURE);
        assertThat(sr.queryString()).endsWith("&timestamp=" + TS + "&signature=" + SignerTest.SIGNATURE);
    }

    @Test
    void marketBuyByQuotePostsSignedOrderWithKeyHeader() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"symbol\":\"ETHUSDT\",\"orderId\":28,\"status\":\"FILLED\"}"));

        JsonNode resp = client.marketBuyByQuote("ethusdt", new BigDecimal("200.0"));

        assertThat(resp.path("orderId").asLong()).isEqualTo(28L);
        RecordedRequest req = server.takeRequest();
        assertThat(req.getMethod()).isEqualTo("POST");
        assertThat(req.getHeader("X-MBX-APIKEY")).isEqualTo("key-1");
        assertThat(req.getPath()).startsWith(CexSigningClient.ORDER
                + "?symbol=ETHUSDT&side=BUY&type=MARKET&quoteOrderQty=200&timestamp=" + TS + "&signature=");
    }

    @Test
    void limitSellCarriesPriceAndTimeInForce() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));

        client.limitSell("ETHUSDT", new BigDecimal("0.5"), new BigDecimal("2500.00"), TimeInForce.IOC);

        String path = server.takeRequest().getPath();
        assertThat(path).contains("side=SELL&type=LIMIT&quantity=0.5&price=2500&timeInForce=IOC&timestamp=");
    }

    @Test
    void cancelUsesDelete() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"status\":\"CANCELED\"}"));

        client.cancelOrder("ETHUSDT", 99L, null);

        RecordedRequest req = server.takeRequest();
        assertThat(req.getMethod()).isEqualTo("DELETE");
        assertThat(req.getPath()).contains("symbol=ETHUSDT&orderId=99&timestamp=");
    }

    @Test
    void reservedCharactersAreEncodedBeforeSigning() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"status\":\"CANCELED\"}"));

        client.cancelOrder("ETHUSDT", null, "my id&x=1+2");

        RecordedRequest req = server.takeRequest();
        String query = req.getRequestUrl().encodedQuery();
        assertThat(query).startsWith("symbol=ETHUSDT&origClientOrderId=my%20id%26x%3D1%2B2&timestamp=" + TS + "&signature=");
        assertThat(req.getRequestUrl().queryParameter("origClientOrderId")).isEqualTo("my id&x=1+2");

        String signed = query.substring(0, query.indexOf("&signature="));
        assertThat(req.getRequestUrl().queryParameter("signature"))
                .isEqualTo(Signer.hmacSha256(SignerTest.SECRET, signed));
    }

    @Test
    void orderReferenceIsRequired() {
        assertThatThrownBy(() -> client.orderStatus("ETHUSDT", null, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void orderHistoryLimitIsCapped() throws Exception {
        server.enqueue(new MockResponse().setBody("[]"));

        client.orderHistory("ETHUSDT", 5000);

        assertThat(server.takeRequest().getPath()).startsWith(CexSigningClient.ALL_ORDERS + "?symbol=ETHUSDT&limit=1000&");
    }

    @Test
    void balanceOfAbsentAssetIsZero() {
        server.enqueue(new MockResponse().setBody(
                "{\"balances\":[{\"asset\":\"USDT\",\"free\":\"1500.25\",\"locked\":\"0\"}]}"));
        server.enqueue(new MockResponse().setBody(
                "{\"balances\":[{\"asset\":\"USDT\",\"free\":\"1500.25\",\"locked\":\"0\"}]}"));

        assertThat(client.getBalance("usdt")).isEqualByComparingTo("1500.25");
        assertThat(client.getBalance("DOGE")).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void clientErrorIsAuth() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"code\":-2015,\"msg\":\"Invalid API-key\"}"));

        assertThatThrownBy(() -> client.accountInfo())
                .isInstanceOfSatisfying(VenueException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.AUTH);
                    assertThat(e.httpStatus()).isEqualTo(401);
                    assertThat(e.body()).contains("Invalid API-key");
                });
    }

    @Test
    void serverErrorIsNetwork() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> client.accountInfo())
                .isInstanceOfSatisfying(VenueException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.NETWORK));
    }

    @Test
    void garbageBodyIsDecode() {
        server.enqueue(new MockResponse().setBody("<html>oops</html>"));

        assertThatThrownBy(() -> client.accountInfo())
                .isInstanceOfSatisfying(VenueException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.DECODE));
    }

    @Test
    void missingKeysFailBeforeAnyRequest() {
        CexSigningClient anonymous = newClient("", "");

        assertThatThrownBy(anonymous::accountInfo)
                .isInstanceOfSatisfying(DomainException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.AUTH));
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void exchangeInfoIsUnsigned() throws Exception {
        server.enqueue(new MockResponse().setBody(EXCHANGE_INFO));

        client.symbolInfo("ETHUSDT");

        RecordedRequest req = server.takeRequest();
        assertThat(req.getPath()).isEqualTo(CexSigningClient.EXCHANGE_INFO);
        assertThat(req.getHeader("X-MBX-APIKEY")).isNull();
    }

    @Test
    void validQuantityAndPricePassFilters() {
        server.enqueue(new MockResponse().setBody(EXCHANGE_INFO));

        client.validateOrderParams("ETHUSDT", new BigDecimal("0.3"), new BigDecimal("2000.15"));
    }

    @Test
    void stepViolationNamesLotSize() {
        server.enqueue(new MockResponse().setBody(EXCHANGE_INFO));

        assertThatThrownBy(() -> client.validateOrderParams("ETHUSDT", new BigDecimal("0.00015"), null))
                .isInstanceOfSatisfying(FilterValidationException.class, e -> {
                    assertThat(e.filterName()).isEqualTo("LOT_SIZE");
                    assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION);
                });
    }

    @Test
    void priceBelowMinimumNamesPriceFilter() {
        server.enqueue(new MockResponse().setBody(EXCHANGE_INFO));

        assertThatThrownBy(() -> client.validateOrderParams("ETHUSDT", new BigDecimal("1"), new BigDecimal("0.001")))
                .isInstanceOfSatisfying(FilterValidationException.class,
                        e -> assertThat(e.filterName()).isEqualTo("PRICE_FILTER"));
    }

    @Test
    void unknownSymbolIsValidationError() {
        server.enqueue(new MockResponse().setBody(EXCHANGE_INFO));

        assertThatThrownBy(() -> client.symbolInfo("DOGEUSDT"))
                .isInstanceOfSatisfying(DomainException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION));
    }
}
