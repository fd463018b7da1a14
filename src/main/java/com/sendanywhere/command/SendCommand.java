package com.sendanywhere.command;

import com.sendanywhere.chunk.ChunkManager;
import com.sendanywhere.chunk.FolderManifest;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.chunk.Manifests;
import com.sendanywhere.chunk.TransferMode;
import com.sendanywhere.config.SendAnywhereConfig;
import com.sendanywhere.lan.LanTransferServer;
import com.sendanywhere.relay.RelayClient;
import com.sendanywhere.signal.PairCodeInfo;
import com.sendanywhere.signal.SignalingClient;
import com.sendanywhere.transfer.TransferEngine;
import com.sendanywhere.transfer.TransferProgress;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@CommandLine.Command(
        name = "send",
        description = "Send a file or folder through the relay or directly over the LAN",
        mixinStandardHelpOptions = true
)
public class SendCommand implements Callable<Integer> {

    enum Mode { RELAY, LAN }

    @CommandLine.Parameters(index = "0", description = "File or folder to send")
    private Path path;

    @CommandLine.Option(names = {"--mode", "-m"}, description = "relay or lan (default: relay)", defaultValue = "RELAY")
    private Mode mode;

    @CommandLine.Option(names = {"--relay"}, description = "Relay server URL (default: http://localhost:<relay.port>)")
    private String relayUrl;

    @CommandLine.Option(names = {"--signaling"}, description = "Signaling server URL (default: http://localhost:<signaling.port>)")
    private String signalingUrl;

    @CommandLine.Option(names = {"--lan-port"}, description = "Port for the LAN server (default: lan.port)")
    private Integer lanPort;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        try {
            return doSend();
        } catch (Exception e) {
            if (json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            throw e;
        }
    }

    private Integer doSend() throws Exception {
        if (!Files.exists(path)) {
            String msg = "path not found: " + path;
            if (json) { JsonOutput.error(msg); return 1; }
            System.err.println("Error: " + msg);
            return 1;
        }

        SendAnywhereConfig config = SendAnywhereConfig.load();
        TransferMode transferMode = mode == Mode.LAN ? TransferMode.LAN : TransferMode.RELAY;
        ChunkManager chunks = new ChunkManager(config.chunkSize(transferMode));

        if (!json) System.out.println("Creating manifest...");
        Manifest manifest = chunks.createManifest(path);
        String transferId = UUID.randomUUID().toString();
        if (json) {
            JsonOutput.manifest(manifest, transferId);
        } else {
            String kind = manifest instanceof FolderManifest folder
                    ? "Folder: " + folder.folderName() + " (" + folder.totalFiles() + " files)"
                    : "File: " + manifest.name();
            System.out.println(kind);
            System.out.println("  Size:   " + formatSize(manifest.totalBytes()));
            System.out.println("  Chunks: " + manifest.totalChunks());
        }

        SignalingClient signaling = new SignalingClient(
                signalingUrl != null ? signalingUrl : "http://localhost:" + config.signalingPort(),
                config.connectTimeout(), config.connectTimeout());
        PairCodeInfo pair = signaling.createPairCode(transferId, Manifests.toTree(manifest));
        if (json) {
            JsonOutput.pairCode(pair);
        } else {
            System.out.println();
            System.out.println("==================================================");
            System.out.println("  PAIR CODE: " + pair.code());
            System.out.println("==================================================");
            System.out.println("Expires in " + pair.expiresIn() + " seconds. Share this code with the receiver.");
        }

        if (mode == Mode.LAN) {
            return serveLan(config, manifest);
        }
        return uploadToRelay(config, manifest, transferId);
    }

    private Integer uploadToRelay(SendAnywhereConfig config, Manifest manifest, String transferId) throws Exception {
        RelayClient relay = new RelayClient(
                relayUrl != null ? relayUrl : "http://localhost:" + config.relayPort(),
                config.connectTimeout(), config.chunkTimeout());
        TransferEngine engine = TransferEngine.fromConfig(config);
        TransferProgress progress = new TransferProgress(manifest.totalBytes(), manifest.chunkSize(), manifest.totalChunks());

        if (!json) System.out.println("Uploading to " + relay.baseUrl() + "...");
        Thread progressThread = progressThread(progress, json);
        progressThread.start();

        engine.upload(relay.transport(transferId), manifest, progress);

        long durationMs = System.currentTimeMillis() - progress.startTimeMs();
        if (json) {
            JsonOutput.uploaded(manifest.totalBytes(), manifest.totalChunks(), durationMs);
        } else {
            System.out.print("\r" + progress.progressBar(30));
            System.out.println();
            System.out.println("Upload complete! The receiver can now download with the pair code.");
        }
        return 0;
    }

    private Integer serveLan(SendAnywhereConfig config, Manifest manifest) throws Exception {
        int port = lanPort != null ? lanPort : config.lanPort();
        LanTransferServer server = new LanTransferServer(manifest, "0.0.0.0", port);
        String address = server.start();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!json) System.out.println("\nShutting down...");
            server.stop();
            stopped.countDown();
        }));

        if (json) {
            JsonOutput.lanServer(address, server.port());
        } else {
            System.out.println("LAN server at " + address + ":" + server.port());
            System.out.println("Receiver: receive --lan " + address + ":" + server.port());
            System.out.println("Press Ctrl+C to stop.");
        }
        stopped.await();
        return 0;
    }

    static Thread progressThread(TransferProgress progress, boolean json) {
        Thread t = new Thread(() -> {
            try {
                while (!progress.isComplete()) {
                    if (json) {
                        JsonOutput.progress(progress);
                    } else {
                        System.out.print("\r" + progress.progressBar(30));
                        System.out.flush();
                    }
                    Thread.sleep(250);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "progress");
        t.setDaemon(true);
        return t;
    }

    static String formatSize(long bytes) {
        if (bytes >= 1_000_000_000) return String.format("%.1f GB", bytes / 1_000_000_000.0);
        if (bytes >= 1_000_000) return String.format("%.1f MB", bytes / 1_000_000.0);
        if (bytes >= 1_000) return String.format("%.1f KB", bytes / 1_000.0);
        return bytes + " B";
    }
}
