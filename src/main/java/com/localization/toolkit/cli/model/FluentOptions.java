package com.localization.toolkit.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options of the fluent-tool command. No validation, no
 * execution logic, no printing.
 */
@Getter
public class FluentOptions {

	@Parameters(arity = "0..*", paramLabel = "FILE", description = "Fluent files to process (.ftl or .ftl.gz)")
	private List<Path> files = new ArrayList<>();

	@Option(names = { "--check", "-c" }, description = "Only check that the files parse and serialize; write nothing")
	private boolean check;

	@Option(names = { "--list", "-l" }, description = "Print the units of each file")
	private boolean list;

	@Option(names = { "--output", "-o" }, description = "Write the re-serialized file here (single input only)")
	private Path output;

	@Option(names = { "--in-place", "-i" }, description = "Rewrite each input file with its re-serialized content")
	private boolean inPlace;

	@Option(names = { "--fail-fast" }, description = "Stop at the first file that fails")
	private boolean failFast;
}
