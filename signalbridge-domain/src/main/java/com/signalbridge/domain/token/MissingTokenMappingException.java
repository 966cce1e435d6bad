package com.signalbridge.domain.token;

import com.signalbridge.domain.DomainException;
import com.signalbridge.domain.ErrorKind;

import java.util.Set;

public final class MissingTokenMappingException extends DomainException {

    private final long chainId;
    private final String symbol;

    public MissingTokenMappingException(long chainId, String symbol, String lookedUp, Set<String> available) {
        super(ErrorKind.MISSING_TOKEN_MAPPING,
                "Token address for " + symbol + " not found on chain " + chainId
                        + " (looked up " + lookedUp + ", available " + available + ")");
        this.chainId = chainId;
        this.symbol = symbol;
    }

    public long chainId() { return chainId; }

    public String symbol() { return symbol; }
}
