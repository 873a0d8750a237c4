package com.localization.toolkit.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.localization.toolkit.cli.exception.OptionsValidationException;
import com.localization.toolkit.cli.model.FluentOptions;
import com.localization.toolkit.cli.model.ValidatedFluentOptions;
import com.localization.toolkit.storage.StoreFactory;
import com.localization.toolkit.tool.OutputMode;

public class FluentOptionsValidator {

	private final StoreFactory storeFactory;

	public FluentOptionsValidator() {
		this(new StoreFactory());
	}

	public FluentOptionsValidator(StoreFactory storeFactory) {
		this.storeFactory = storeFactory;
	}

	public ValidatedFluentOptions validate(FluentOptions o) {
		List<String> errors = new ArrayList<>();
		List<Path> inputs = new ArrayList<>();

		if (o.getFiles() == null || o.getFiles().isEmpty()) {
			errors.add("At least one input file is required.");
		} else {
			for (Path file : o.getFiles()) {
				Path normalized = file.toAbsolutePath().normalize();
				if (!Files.isRegularFile(normalized)) {
					errors.add("Input file does not exist or is not a regular file: " + file);
				} else if (!storeFactory.supports(file.getFileName().toString())) {
					errors.add("Unsupported file type: " + file + " (expected one of " + describeExtensions() + ")");
				}
				inputs.add(normalized);
			}
		}

		if (o.getOutput() != null && o.isInPlace()) {
			errors.add("--output and --in-place cannot be used together.");
		}
		if (o.getOutput() != null && inputs.size() > 1) {
			errors.add("--output can only be used with a single input file. Got: " + inputs.size());
		}
		if (o.isCheck() && (o.getOutput() != null || o.isInPlace())) {
			errors.add("--check does not write files; remove --output / --in-place.");
		}

		Path outputFile = null;
		if (o.getOutput() != null) {
			outputFile = o.getOutput().toAbsolutePath().normalize();
			if (!storeFactory.supports(outputFile.getFileName().toString())) {
				errors.add("Unsupported output file type: " + o.getOutput());
			}
			Path parent = outputFile.getParent();
			if (parent != null && !Files.isDirectory(parent)) {
				errors.add("Output directory does not exist: " + parent);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedFluentOptions(List.copyOf(inputs), resolveOutputMode(o), outputFile);
	}

	private static OutputMode resolveOutputMode(FluentOptions o) {
		if (o.isCheck()) {
			return OutputMode.NONE;
		}
		if (o.getOutput() != null) {
			return OutputMode.FILE;
		}
		if (o.isInPlace()) {
			return OutputMode.IN_PLACE;
		}
		// listing alone prints units, not file content
		return o.isList() ? OutputMode.NONE : OutputMode.STDOUT;
	}

	private String describeExtensions() {
		List<String> names = new ArrayList<>();
		for (String extension : storeFactory.getExtensions()) {
			names.add("." + extension);
			names.add("." + extension + ".gz");
		}
		return String.join(", ", names);
	}
}
