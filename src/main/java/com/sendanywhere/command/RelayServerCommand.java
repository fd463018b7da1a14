package com.sendanywhere.command;

import com.sendanywhere.config.SendAnywhereConfig;
import com.sendanywhere.relay.RelayServer;
import com.sendanywhere.relay.RelayStore;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@CommandLine.Command(
        name = "relay",
        description = "Run the relay chunk store server",
        mixinStandardHelpOptions = true
)
public class RelayServerCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"--host"}, description = "Bind address (default: relay.host)")
    private String host;

    @CommandLine.Option(names = {"--port", "-p"}, description = "HTTP port (default: relay.port)")
    private Integer port;

    @CommandLine.Option(names = {"--storage", "-d"}, description = "Storage directory (default: relay.storage-dir)")
    private Path storage;

    @CommandLine.Option(names = {"--retention-hours"}, description = "Delete transfers older than this (default: relay.cleanup-after-hours)")
    private Long retentionHours;

    @CommandLine.Option(names = {"--sweep-minutes"}, description = "Background sweep period, 0 disables (default: relay.sweep-interval-minutes)")
    private Long sweepMinutes;

    @Override
    public Integer call() throws Exception {
        SendAnywhereConfig config = SendAnywhereConfig.load();
        RelayStore store = new RelayStore(
                storage != null ? storage : config.relayStorageDir(),
                retentionHours != null ? Duration.ofHours(retentionHours) : config.relayRetention());
        RelayServer server = new RelayServer(store,
                host != null ? host : config.relayHost(),
                port != null ? port : config.relayPort(),
                sweepMinutes != null ? Duration.ofMinutes(sweepMinutes) : config.relaySweepInterval());

        CountDownLatch stopped = new CountDownLatch(1);
        // Shut down cleanly on Ctrl+C
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            server.stop();
            stopped.countDown();
        }));

        server.start();
        stopped.await();
        return 0;
    }
}
