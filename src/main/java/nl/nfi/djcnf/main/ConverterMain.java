package nl.nfi.djcnf.main;

import nl.nfi.djcnf.cli.CnfConverterCli;
import picocli.CommandLine;

public final class ConverterMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new CnfConverterCli()).execute(args);
        System.exit(exitCode);
    }
}
