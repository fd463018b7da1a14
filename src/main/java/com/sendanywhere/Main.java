package com.sendanywhere;

import com.sendanywhere.command.ReceiveCommand;
import com.sendanywhere.command.RelayServerCommand;
import com.sendanywhere.command.SendCommand;
import com.sendanywhere.command.SignalingServerCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "send-anywhere",
        description = "Chunked, resumable file and folder transfer",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                RelayServerCommand.class,
                SignalingServerCommand.class,
                SendCommand.class,
                ReceiveCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /** Enum options such as {@code --mode} accept any case. */
    public static CommandLine commandLine() {
        return new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
