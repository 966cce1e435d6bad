package com.signalbridge.application.usecase;

import com.signalbridge.application.config.PipelineSettings;
import com.signalbridge.application.execution.ExecutionReport;
import com.signalbridge.application.execution.ExecutionRouter;
import com.signalbridge.domain.DomainException;
import com.signalbridge.domain.ErrorKind;
import com.signalbridge.domain.intent.ContractEvent;
import com.signalbridge.domain.intent.ContractEventNormalizer;
import com.signalbridge.domain.intent.IntentParser;
import com.signalbridge.domain.intent.TransactionIntent;
import com.signalbridge.domain.risk.BalanceLookup;
import com.signalbridge.domain.risk.MarketConditionGate;
import com.signalbridge.domain.risk.PositionSizer;
import com.signalbridge.domain.risk.RiskDecision;
import com.signalbridge.domain.risk.RiskGate;
import com.signalbridge.domain.risk.SizingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unified use-case pipeline: Parse -> Risk -> Sizing -> Market -> Route -> Execute.
 *
 * Each stage can short-circuit; only accepted intents reach a venue adapter.
 * Never throws for a bad or failing event: every failure comes back as a {@link PipelineResult}.
 */
public class TransactionPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransactionPipeline.class);

    private final IntentParser parser;
    private final ContractEventNormalizer contractEvents;
    private final RiskGate riskGate;
    private final PositionSizer sizer;
    private final MarketConditionGate marketGate;
    private final ExecutionRouter router;
    private final BalanceLookup balances;

    public TransactionPipeline(IntentParser parser,
                               ContractEventNormalizer contractEvents,
                               RiskGate riskGate,
                               PositionSizer sizer,
                               MarketConditionGate marketGate,
                               ExecutionRouter router,
                               BalanceLookup balances) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.contractEvents = Objects.requireNonNull(contractEvents, "contractEvents");
        this.riskGate = Objects.requireNonNull(riskGate, "riskGate");
        this.sizer = Objects.requireNonNull(sizer, "sizer");
        this.marketGate = Objects.requireNonNull(marketGate, "marketGate");
        this.router = Objects.requireNonNull(router, "router");
        this.balances = Objects.requireNonNull(balances, "balances");
    }

    /** Default stage set for the given policy settings. */
    public static TransactionPipeline create(PipelineSettings settings, ExecutionRouter router, BalanceLookup balances) {
        return new TransactionPipeline(
                new IntentParser(),
                new ContractEventNormalizer(),
                new RiskGate(settings.riskLimits()),
                new PositionSizer(settings.riskLimits()),
                new MarketConditionGate(),
                router,
                balances
        );
    }

    public PipelineResult process(ContractEvent event) {
        String wire;
        try {
            wire = contractEvents.toWire(event);
        } catch (DomainException e) {
            log.warn("Rejected contract event {}: {}", event, e.getMessage());
            return PipelineResult.failed(null, e.kind(), e.getMessage(), List.of());
        }
        return process(wire);
    }

    public PipelineResult process(String rawEvent) {
        List<String> warnings = new ArrayList<>();
        TransactionIntent intent = null;
        try {
            intent = parser.parse(rawEvent);
            log.info("Intent received: {}", intent);

            RiskDecision risk = riskGate.check(intent, balances);
            if (!risk.allowed()) {
                log.info("Transaction blocked by risk management: {}", risk.reason());
                return PipelineResult.rejected(intent, ErrorKind.RISK_REJECTED, risk.reason(), warnings);
            }
            if (!risk.verified()) {
                warnings.add(risk.reason());
            }

            SizingResult sizing = sizer.adjust(intent, balances);
            if (sizing.warning() != null) {
                warnings.add(sizing.warning());
            }
            intent = sizing.intent();

            RiskDecision market = marketGate.check(intent);
            if (!market.allowed()) {
                log.info("Transaction blocked by market conditions: {}", market.reason());
                return PipelineResult.rejected(intent, ErrorKind.MARKET_REJECTED, market.reason(), warnings);
            }

            ExecutionReport report = router.route(intent);
            log.info("Executed: {}", report.summary());
            if (!warnings.isEmpty()) {
                log.warn("Executed with unverified checks, needs review: {}", warnings);
            }
            return PipelineResult.executed(intent, report, warnings);

        } catch (DomainException e) {
            log.warn("Event failed [{}]: {} (event={})", e.kind(), e.getMessage(), rawEvent);
            return PipelineResult.failed(intent, e.kind(), e.getMessage(), warnings);

        } catch (Exception e) {
            log.error("Unexpected error handling event {}", rawEvent, e);
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return PipelineResult.failed(intent, ErrorKind.UNEXPECTED, msg, warnings);
        }
    }
}
