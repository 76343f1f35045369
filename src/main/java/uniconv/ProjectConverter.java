package uniconv;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Converts a tree of source files to a parallel tree in the target language.
 *
 * Each input file produces one output file at the same relative path with the
 * target extension. Files with other extensions are ignored.
 */
public final class ProjectConverter {
	private static final Logger LOG = Logger.getLogger(ProjectConverter.class.getName());

	private final Converter converter;

	public ProjectConverter() {
		this(new Converter());
	}

	public ProjectConverter(Converter converter) {
		this.converter = converter;
	}

	/**
	 * @return the files written
	 */
	public List<Path> convertTree(Path sourceRoot, Path outRoot, Language source, Language target)
			throws IOException {
		// fail before walking the tree when the source has no parser
		converter.parserFor(source);
		String suffix = "." + source.extension();
		try (Stream<Path> paths = Files.walk(sourceRoot)) {
			return paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(suffix))
					.sorted()
					.map(p -> {
						try {
							return convertOne(sourceRoot, outRoot, p, source, target);
						} catch (IOException e) {
							throw new UncheckedIOException(e);
						}
					})
					.collect(Collectors.toList());
		} catch (UncheckedIOException ex) {
			throw ex.getCause();
		}
	}

	private Path convertOne(Path sourceRoot, Path outRoot, Path sourceFile, Language source, Language target)
			throws IOException {
		Path rel = sourceRoot.relativize(sourceFile);
		String fileName = rel.getFileName().toString();
		String base = fileName.substring(0, fileName.length() - source.extension().length() - 1);
		String outName = base + "." + target.extension();
		Path outRel = rel.getParent() == null ? Path.of(outName) : rel.getParent().resolve(outName);
		Path outFile = outRoot.resolve(outRel);

		if (outFile.getParent() != null) {
			Files.createDirectories(outFile.getParent());
		}
		String text = Files.readString(sourceFile);
		Files.writeString(outFile, converter.convert(text, source, target));
		LOG.fine(() -> "wrote " + outFile);
		return outFile;
	}
}
