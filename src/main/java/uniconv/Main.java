package uniconv;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import uniconv.parse.ParseMode;
import uniconv.parse.SourceParseException;
import uniconv.print.FormatOptions;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point. Reads one file, a directory tree, or standard
 * input, and writes the converted program to a file, a tree, or standard
 * output.
 */
@Command(name = "uniconv", version = "uniconv 1.0.0", mixinStandardHelpOptions = true,
		description = "Converts small programs between python, java, cpp and javascript.")
public final class Main implements Callable<Integer> {
	static final int EXIT_PARSE_ERROR = 1;
	static final int EXIT_UNSUPPORTED = 2;

	private static final Logger LOG = Logger.getLogger(Main.class.getName());

	@Spec
	CommandSpec spec;

	@Option(names = {"-f", "--from"}, required = true, description = "Source language: python, java or cpp")
	String from;

	@Option(names = {"-t", "--to"}, required = true, description = "Target language: python, java, cpp or javascript")
	String to;

	@Option(names = "--strict", description = "Fail on lines and expressions that are not understood")
	boolean strict;

	@Option(names = "--indent", defaultValue = "4", description = "Spaces per indentation level (default 4)")
	int indent;

	@Option(names = "--tabs", description = "Indent with tabs")
	boolean tabs;

	@Option(names = "--class-name", defaultValue = "ConvertedCode", description = "Class wrapping generated Java")
	String className;

	@Option(names = {"-o", "--output"}, description = "Output file, or output directory for a directory input")
	Path output;

	@Option(names = {"-v", "--verbose"}, description = "Log dropped lines and fallback expressions")
	boolean verbose;

	@Parameters(index = "0", arity = "0..1", description = "Input file or directory (standard input if omitted)")
	Path input;

	public static void main(String[] args) {
		System.exit(new CommandLine(new Main()).execute(args));
	}

	@Override
	public Integer call() throws IOException {
		if (verbose) {
			enableVerboseLogging();
		}
		PrintWriter out = spec.commandLine().getOut();
		PrintWriter err = spec.commandLine().getErr();

		Language source;
		Language target;
		try {
			source = Language.fromKey(from);
			target = Language.fromKey(to);
		} catch (UnsupportedLanguageException e) {
			err.println("error: " + e.getMessage());
			return EXIT_UNSUPPORTED;
		}

		Converter converter = new Converter(options());
		try {
			if (input != null && Files.isDirectory(input)) {
				return convertTree(converter, source, target, out, err);
			}
			String text = input == null
					? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
					: Files.readString(input);
			String result = converter.convert(text, source, target);
			if (output == null) {
				out.println(result);
			} else {
				Files.writeString(output, result);
			}
			return 0;
		} catch (UnsupportedLanguageException e) {
			err.println("error: " + e.getMessage());
			return EXIT_UNSUPPORTED;
		} catch (SourceParseException e) {
			LOG.log(Level.FINE, "strict parse failed", e);
			err.println("error: " + e.getMessage());
			return EXIT_PARSE_ERROR;
		}
	}

	private int convertTree(Converter converter, Language source, Language target, PrintWriter out,
			PrintWriter err) throws IOException {
		if (output == null) {
			err.println("error: --output is required when the input is a directory");
			return CommandLine.ExitCode.USAGE;
		}
		List<Path> written = new ProjectConverter(converter).convertTree(input, output, source, target);
		out.println("converted " + written.size() + " file(s) into " + output);
		return 0;
	}

	ConverterOptions options() {
		FormatOptions format = FormatOptions.defaults().withClassName(className);
		format = tabs ? format.withTabs() : format.withIndentWidth(indent);
		return new ConverterOptions(strict ? ParseMode.STRICT : ParseMode.BEST_EFFORT, format);
	}

	private static void enableVerboseLogging() {
		Logger root = Logger.getLogger("uniconv");
		root.setLevel(Level.FINE);
		ConsoleHandler handler = new ConsoleHandler();
		handler.setLevel(Level.FINE);
		root.addHandler(handler);
	}
}
