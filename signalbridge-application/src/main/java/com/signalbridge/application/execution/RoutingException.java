package com.signalbridge.application.execution;

import com.signalbridge.domain.DomainException;
import com.signalbridge.domain.ErrorKind;

public final class RoutingException extends DomainException {

    public RoutingException(String message) {
        super(ErrorKind.ROUTING, message);
    }
}
