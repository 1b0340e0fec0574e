package dev.astas.chapterdl;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/** Main application class with CLI support */
@Command(
		name = "chapter-downloader",
		version = "1.0.0",
		description = "Downloads chapter images from a shared job queue with adaptive per-source limits",
		mixinStandardHelpOptions = true,
		subcommands = {WorkerCommand.class, EnqueueCommand.class, StatsCommand.class})
public class Main {

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
