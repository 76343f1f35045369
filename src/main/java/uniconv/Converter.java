package uniconv;

import uniconv.ast.Program;
import uniconv.parse.SourceParser;
import uniconv.parse.cpp.CppParser;
import uniconv.parse.java.JavaParser;
import uniconv.parse.python.PythonParser;
import uniconv.print.CppPrinter;
import uniconv.print.JavaPrinter;
import uniconv.print.JavaScriptPrinter;
import uniconv.print.PythonPrinter;
import uniconv.print.SourcePrinter;
import uniconv.transform.IrTransformer;
import uniconv.transform.Transformers;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Public entrypoint: source text in one language to source text in another.
 *
 * Both languages are resolved before the text is looked at, so an unsupported
 * key fails without any partial output. A converter holds only its options and
 * may be shared between threads.
 */
public final class Converter {
	private static final Logger LOG = Logger.getLogger(Converter.class.getName());

	private final ConverterOptions options;

	public Converter() {
		this(ConverterOptions.defaults());
	}

	public Converter(ConverterOptions options) {
		this.options = Objects.requireNonNull(options, "options");
	}

	public ConverterOptions options() {
		return options;
	}

	/**
	 * Converts using language keys such as {@code "python"} or {@code "cpp"}.
	 *
	 * @throws UnsupportedLanguageException when either key is unknown or the
	 *                                      source language has no parser
	 */
	public String convert(String sourceText, String sourceKey, String targetKey) {
		Language source = Language.fromKey(sourceKey);
		Language target = Language.fromKey(targetKey);
		return convert(sourceText, source, target);
	}

	/**
	 * Parses and renders with no transformer stage in between.
	 */
	public String convert(String sourceText, Language source, Language target) {
		SourceParser parser = parserFor(source);
		SourcePrinter printer = printerFor(target);
		return run(sourceText, parser, printer, IrTransformer.identity(), source, target);
	}

	/**
	 * Parses, applies {@code transformer}, then renders.
	 */
	public String convert(String sourceText, Language source, Language target, IrTransformer transformer) {
		Objects.requireNonNull(transformer, "transformer");
		SourceParser parser = parserFor(source);
		SourcePrinter printer = printerFor(target);
		return run(sourceText, parser, printer, transformer, source, target);
	}

	/**
	 * Like {@link #convert(String, Language, Language)} with the registered
	 * transformer for the target applied.
	 */
	public String convertWithRegisteredTransformer(String sourceText, Language source, Language target) {
		return convert(sourceText, source, target, Transformers.forTarget(target));
	}

	private String run(String sourceText, SourceParser parser, SourcePrinter printer, IrTransformer transformer,
			Language source, Language target) {
		Objects.requireNonNull(sourceText, "sourceText");
		Program program = transformer.transform(parser.parse(sourceText));
		LOG.fine(() -> "converted " + program.statements().size() + " top-level statements from " + source.key()
				+ " to " + target.key());
		return printer.render(program);
	}

	public SourceParser parserFor(Language language) {
		return switch (language) {
			case PYTHON -> new PythonParser(options.mode());
			case JAVA -> new JavaParser(options.mode());
			case CPP -> new CppParser(options.mode());
			case JAVASCRIPT -> throw new UnsupportedLanguageException(language, "source");
		};
	}

	public SourcePrinter printerFor(Language language) {
		return switch (language) {
			case PYTHON -> new PythonPrinter(options.format());
			case JAVA -> new JavaPrinter(options.format());
			case CPP -> new CppPrinter(options.format());
			case JAVASCRIPT -> new JavaScriptPrinter(options.format());
		};
	}
}
