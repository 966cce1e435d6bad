package com.signalbridge.exchange;

public enum TimeInForce {
    GTC,
    IOC,
    FOK
}
