package com.signalbridge.application.execution;

import com.signalbridge.domain.intent.TransactionIntent;
import com.signalbridge.domain.intent.Venue;

public interface VenueExecutor {

    Venue venue();

    ExecutionReport execute(TransactionIntent intent) throws Exception;
}
