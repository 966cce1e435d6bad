package com.signalbridge.exchange;

import com.signalbridge.domain.DomainException;
import com.signalbridge.domain.ErrorKind;

/**
 * Order parameters violate one of the symbol's trading-rule filters (LOT_SIZE, PRICE_FILTER).
 */
public class FilterValidationException extends DomainException {

    private final String filterName;

    public FilterValidationException(String filterName, String message) {
        super(ErrorKind.VALIDATION, filterName + ": " + message);
        this.filterName = filterName;
    }

    public String filterName() {
        return filterName;
    }
}
