package dev.wrt;

import dev.wrt.cli.WorkflowReportCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new WorkflowReportCli()).execute(args);
        System.exit(exitCode);
    }
}
