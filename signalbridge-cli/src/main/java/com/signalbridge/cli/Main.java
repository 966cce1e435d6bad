package com.signalbridge.cli;

import com.signalbridge.application.ports.ConfigPort;
import com.signalbridge.application.service.IntentWorker;
import com.signalbridge.application.usecase.PipelineOutcome;
import com.signalbridge.application.usecase.PipelineResult;
import com.signalbridge.application.usecase.TransactionPipeline;
import com.signalbridge.cli.bootstrap.Bootstrap;
import com.signalbridge.cli.tools.ConfigDoctor;
import com.signalbridge.domain.intent.ContractEvent;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

public class Main {

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            printHelp();
            System.exit(1);
            return;
        }

        String cmd = command(args[0]);
        String[] tail = Arrays.copyOfRange(args, 1, args.length);

        switch (cmd) {
            case "process":
                System.exit(processEvents(tail));
                return;

            case "contract":
                System.exit(processContractEvent(tail));
                return;

            case "run":
                runWorker();
                return;

            case "validate-config":
                System.exit(ConfigDoctor.run(Bootstrap.loadConfig(), System.out));
                return;

            case "help":
            case "--help":
            case "-h":
                printHelp();
                return;

            default:
                System.err.println("Unknown command: " + cmd);
                printHelp();
                System.exit(1);
        }
    }

    private static int processEvents(String[] events) {
        if (events.length == 0) {
            System.err.println("Usage: process \"|cex|0.1|2000|ETH|buy|\" [...]");
            return 1;
        }
        TransactionPipeline pipeline = Bootstrap.createPipeline(Bootstrap.loadConfig());

        int code = 0;
        for (String e : events) {
            PipelineResult r = pipeline.process(e);
            System.out.println(format(r));
            if (r.outcome() == PipelineOutcome.FAILED) code = 2;
        }
        return code;
    }

    private static int processContractEvent(String[] a) {
        if (a.length != 5) {
            System.err.println("Usage: contract <exType> <quantityWei> <expectedPriceWei> <pair> <side>");
            return 1;
        }
        ContractEvent event;
        try {
            event = new ContractEvent(a[0], new BigInteger(a[1]), new BigInteger(a[2]), a[3], a[4]);
        } catch (NumberFormatException ex) {
            System.err.println("quantity and expectedPrice must be integers (wei): " + ex.getMessage());
            return 1;
        }
        PipelineResult r = Bootstrap.createPipeline(Bootstrap.loadConfig()).process(event);
        System.out.println(format(r));
        return r.outcome() == PipelineOutcome.FAILED ? 2 : 0;
    }

    /** Reads one raw event per stdin line until EOF, then drains and stops the worker. */
    private static void runWorker() throws IOException, InterruptedException {
        ConfigPort config = Bootstrap.loadConfig();
        IntentWorker worker = Bootstrap.createWorker(config, r -> System.out.println(format(r)));

        Thread t = new Thread(worker, "intent-worker");
        t.start();
        System.out.println("[SignalBridge] Worker running. One event per line, Ctrl-D to stop.");

        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                worker.submit(line.trim());
            }
        }

        while (worker.pending() > 0) {
            Thread.sleep(100);
        }
        worker.stop();
        t.join();
        System.out.println("[SignalBridge] Stopped after " + worker.processedCount() + " events.");
    }

    static String command(String arg) {
        return arg.trim().toLowerCase(Locale.ROOT);
    }

    static String format(PipelineResult r) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(r.outcome()).append(']');
        if (r.errorKind() != null) sb.append(' ').append(r.errorKind());
        if (r.message() != null) sb.append(' ').append(r.message());
        if (!r.warnings().isEmpty()) sb.append(" warnings=").append(r.warnings());
        return sb.toString();
    }

    private static void printHelp() {
        System.out.println("SignalBridge CLI");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  process <event> [<event> ...]   run raw events \"|venue|quantity|price|pair|side|\" through the pipeline");
        System.out.println("  contract <exType> <qtyWei> <priceWei> <pair> <side>   run a contract event (18-decimal integers)");
        System.out.println("  run                             background worker fed one event per stdin line");
        System.out.println("  validate-config                 offline configuration check");
        System.out.println("  help                            this text");
    }
}
