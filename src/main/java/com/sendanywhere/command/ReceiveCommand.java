package com.sendanywhere.command;

import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.chunk.Manifests;
import com.sendanywhere.config.SendAnywhereConfig;
import com.sendanywhere.lan.LanTransferClient;
import com.sendanywhere.relay.RelayClient;
import com.sendanywhere.signal.PairInfo;
import com.sendanywhere.signal.SignalingClient;
import com.sendanywhere.transfer.ChunkTransport;
import com.sendanywhere.transfer.DownloadReport;
import com.sendanywhere.transfer.TransferEngine;
import com.sendanywhere.transfer.TransferProgress;
import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import static com.sendanywhere.command.SendCommand.formatSize;
import static com.sendanywhere.command.SendCommand.progressThread;

@CommandLine.Command(
        name = "receive",
        description = "Receive a file or folder by pair code (relay) or straight from a LAN sender",
        mixinStandardHelpOptions = true
)
public class ReceiveCommand implements Callable<Integer> {

    static class Source {
        @CommandLine.Option(names = {"--code", "-c"}, description = "Pair code from the sender", required = true)
        String code;

        @CommandLine.Option(names = {"--lan"}, description = "LAN sender address (host:port)", required = true)
        String lan;
    }

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private Source source;

    @CommandLine.Option(names = {"--output", "-o"}, description = "Output directory (default: current directory)", defaultValue = ".")
    private Path outputDir;

    @CommandLine.Option(names = {"--relay"}, description = "Relay server URL (default: http://localhost:<relay.port>)")
    private String relayUrl;

    @CommandLine.Option(names = {"--signaling"}, description = "Signaling server URL (default: http://localhost:<signaling.port>)")
    private String signalingUrl;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        try {
            return doReceive();
        } catch (Exception e) {
            if (json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            throw e;
        }
    }

    private Integer doReceive() throws Exception {
        SendAnywhereConfig config = SendAnywhereConfig.load();
        ChunkTransport transport;
        Manifest manifest;

        if (source.code != null) {
            SignalingClient signaling = new SignalingClient(
                    signalingUrl != null ? signalingUrl : "http://localhost:" + config.signalingPort(),
                    config.connectTimeout(), config.connectTimeout());
            if (json) JsonOutput.status("resolving_code");
            PairInfo info = signaling.getInfo(source.code);
            manifest = Manifests.fromTree(info.manifest());
            RelayClient relay = new RelayClient(
                    relayUrl != null ? relayUrl : "http://localhost:" + config.relayPort(),
                    config.connectTimeout(), config.chunkTimeout());
            transport = relay.transport(info.transferId());
            if (json) {
                JsonOutput.manifest(manifest, info.transferId());
            } else {
                System.out.println("Pair code " + info.code() + " -> transfer " + info.transferId());
            }
        } else {
            String[] parts = source.lan.split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("LAN address must be host:port, got: " + source.lan);
            }
            LanTransferClient lan = new LanTransferClient(parts[0], Integer.parseInt(parts[1]),
                    config.connectTimeout(), config.chunkTimeout());
            manifest = lan.manifest();
            transport = lan;
            if (json) JsonOutput.manifest(manifest, null);
        }

        if (!json) {
            System.out.println("Receiving " + manifest.name() + " (" + formatSize(manifest.totalBytes())
                    + ", " + manifest.totalChunks() + " chunks) from " + transport.describe());
        }

        Path destination = outputDir.resolve(Paths.get(manifest.name()).getFileName());
        TransferEngine engine = TransferEngine.fromConfig(config);
        TransferProgress progress = new TransferProgress(manifest.totalBytes(), manifest.chunkSize(), manifest.totalChunks());
        Thread progressThread = progressThread(progress, json);
        progressThread.start();

        DownloadReport report = engine.download(transport, destination, progress);
        progress.onChunk(manifest.totalChunks(), manifest.totalChunks());

        long durationMs = System.currentTimeMillis() - progress.startTimeMs();
        if (json) {
            JsonOutput.downloaded(report, durationMs);
        } else {
            System.out.print("\r" + progress.progressBar(30));
            System.out.println();
            System.out.println("Saved to " + report.output());
            System.out.printf("  %d of %d files verified%n", report.verifiedCount(), report.files().size());
            for (DownloadReport.FileResult bad : report.mismatches()) {
                System.err.println("  Integrity check FAILED: " + bad.name());
            }
        }
        return report.verified() ? 0 : 2;
    }
}
