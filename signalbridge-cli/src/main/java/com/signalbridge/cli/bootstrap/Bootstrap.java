package com.signalbridge.cli.bootstrap;

import com.signalbridge.application.config.ConfigKey;
import com.signalbridge.application.config.PipelineSettings;
import com.signalbridge.application.execution.CexExecutor;
import com.signalbridge.application.execution.DexExecutor;
import com.signalbridge.application.execution.ExecutionRouter;
import com.signalbridge.application.ports.ConfigPort;
import com.signalbridge.application.service.IntentWorker;
import com.signalbridge.application.usecase.PipelineResult;
import com.signalbridge.application.usecase.TransactionPipeline;
import com.signalbridge.domain.token.TokenRegistry;
import com.signalbridge.exchange.CexSigningClient;
import com.signalbridge.exchange.DexQuoteClient;
import com.signalbridge.infrastructure.config.FileConfigService;
import com.signalbridge.infrastructure.exchange.CexVenueAdapter;

import java.io.IOException;
import java.time.Clock;
import java.util.function.Consumer;

public final class Bootstrap {

    private Bootstrap() {
    }

    /**
     * Loads config from the working directory (config/config.properties, .env, secrets.properties, env).
     */
    public static ConfigPort loadConfig() {
        try {
            return FileConfigService.defaultFromWorkingDir();
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Failed to load config from working directory. " +
                    "Make sure config/config.properties is readable and try again.",
                    e
            );
        }
    }

    /**
     * Wires both venues and the default stage set using the provided ConfigPort.
     */
    public static TransactionPipeline createPipeline(ConfigPort config) {
        PipelineSettings settings = PipelineSettings.fromConfig(config);
        TokenRegistry tokens = TokenRegistry.defaults();

        CexVenueAdapter cex = new CexVenueAdapter(CexSigningClient.fromConfig(config, Clock.systemUTC()));
        DexQuoteClient dex = DexQuoteClient.fromConfig(config);

        ExecutionRouter router = new ExecutionRouter()
                .register(new CexExecutor(cex, settings.quoteAsset(), settings.validateCexFilters()))
                .register(new DexExecutor(dex, tokens, settings.chainId(), settings.walletAddress(),
                        settings.slippageLimitPercent(), settings.quoteAsset()));

        return TransactionPipeline.create(settings, router, cex);
    }

    public static IntentWorker createWorker(ConfigPort config, Consumer<PipelineResult> listener) {
        int capacity = config.getInt(ConfigKey.WORKER_QUEUE_CAPACITY.key(), 1000);
        return new IntentWorker(createPipeline(config), capacity, listener);
    }
}
