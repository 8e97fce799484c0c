package io.evitadb.polyglot;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * Receives the files found by the {@link Traverser}.
 */
@FunctionalInterface
public interface Visitor {
	/**
	 * Called for each file that matches the configured pattern.
	 *
	 * @param file    path to the file that matched
	 * @param content full textual contents of the file
	 */
	void visit(@Nonnull Path file, @Nonnull String content);
}
