package com.sendanywhere.command;

import com.sendanywhere.config.SendAnywhereConfig;
import com.sendanywhere.signal.SignalingHub;
import com.sendanywhere.signal.SignalingServer;
import picocli.CommandLine;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@CommandLine.Command(
        name = "signal",
        description = "Run the pairing code / signaling server",
        mixinStandardHelpOptions = true
)
public class SignalingServerCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"--host"}, description = "Bind address (default: signaling.host)")
    private String host;

    @CommandLine.Option(names = {"--port", "-p"}, description = "HTTP port (default: signaling.port)")
    private Integer port;

    @CommandLine.Option(names = {"--code-length"}, description = "Digits per pairing code (default: pair-code.length)")
    private Integer codeLength;

    @CommandLine.Option(names = {"--ttl-seconds"}, description = "Pairing code lifetime (default: pair-code.ttl-seconds)")
    private Long ttlSeconds;

    @Override
    public Integer call() throws Exception {
        SendAnywhereConfig config = SendAnywhereConfig.load();
        SignalingHub hub = new SignalingHub(
                codeLength != null ? codeLength : config.pairCodeLength(),
                ttlSeconds != null ? Duration.ofSeconds(ttlSeconds) : config.pairCodeTtl());
        SignalingServer server = new SignalingServer(hub,
                host != null ? host : config.signalingHost(),
                port != null ? port : config.signalingPort());

        CountDownLatch stopped = new CountDownLatch(1);
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
