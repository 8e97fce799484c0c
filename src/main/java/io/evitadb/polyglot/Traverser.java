package io.evitadb.polyglot;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Walks a source directory recursively and hands every file whose path matches a pattern to a {@link Visitor},
 * together with its UTF-8 content.
 *
 * - Files are visited in lexicographical order of their paths, so runs are reproducible.
 * - Only regular files are visited; symbolic links are not followed.
 * - At most `limit` files are visited.
 */
public final class Traverser {

	@Nonnull
	private final Path sourceDir;
	@Nonnull
	private final Pattern filePattern;
	private final int limit;
	@Nonnull
	private final Visitor visitor;

	/**
	 * Create a traverser.
	 *
	 * @param sourceDir   root directory to traverse
	 * @param filePattern regex matched against the whole path string
	 * @param limit       maximum number of files to visit
	 * @param visitor     callback to process file contents
	 */
	public Traverser(
		@Nonnull final Path sourceDir,
		@Nonnull final Pattern filePattern,
		final int limit,
		@Nonnull final Visitor visitor
	) {
		this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir must not be null");
		this.filePattern = Objects.requireNonNull(filePattern, "filePattern must not be null");
		this.limit = limit;
		this.visitor = Objects.requireNonNull(visitor, "visitor must not be null");
	}

	/**
	 * Perform the traversal.
	 *
	 * @return number of visited files
	 * @throws IOException when the directory cannot be read
	 */
	public int traverse() throws IOException {
		if (!Files.exists(this.sourceDir)) {
			throw new IOException("Source directory does not exist: " + this.sourceDir);
		}
		if (!Files.isDirectory(this.sourceDir)) {
			throw new IOException("Source path is not a directory: " + this.sourceDir);
		}

		final List<Path> files = new ArrayList<>();
		collectFiles(this.sourceDir, files);
		files.sort(Comparator.comparing(Path::toString));

		int visited = 0;
		for (final Path file : files) {
			if (visited >= this.limit) {
				break;
			}
			if (!this.filePattern.matcher(file.toString()).matches()) {
				continue;
			}
			final String content = Files.readString(file, StandardCharsets.UTF_8);
			this.visitor.visit(file, content);
			visited++;
		}
		return visited;
	}

	private static void collectFiles(@Nonnull final Path dir, @Nonnull final List<Path> out) throws IOException {
		final List<Path> children = new ArrayList<>();
		try (Stream<Path> stream = Files.list(dir)) {
			stream.forEach(children::add);
		}
		children.sort(Comparator.comparing(Path::toString));
		for (final Path child : children) {
			final BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class);
			if (attrs.isDirectory()) {
				collectFiles(child, out);
			} else if (attrs.isRegularFile()) {
				out.add(child);
			}
		}
	}
}
