package com.signalbridge.exchange;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignerTest {

    // Published example from the Binance REST API documentation
    static final String SECRET = "NhqPtmdSJYdKjVHjA7PZj4Mge3R5YNiP1e3UZjInClVN65XAbvqqM6A7H5fATj0j";
    static final String QUERY = "symbol=LTCBTC&side=BUY&type=LIMIT&timeInForce=GTC&quantity=1&price=0.1"
            + "&recvWindow=5000&timestamp=1499827319559";
    static final String SIGNATURE = "c8db56825ae71d6d79447849e617115f4a920fa2acdcab2b053c4b2838bd6b71";

    @Test
    void matchesPublishedVector() {
        assertThat(Signer.hmacSha256(SECRET, QUERY)).isEqualTo(SIGNATURE);
    }

    @Test
    void isLowercaseHex() {
        assertThat(Signer.hmacSha256("k", "v")).matches("[0-9a-f]{64}");
    }
}
