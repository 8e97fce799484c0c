package io.evitadb.polyglot;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes translated documents to the target directory tree.
 */
public final class Writer {

	/**
	 * Writes the content to the target file in UTF-8, creating missing parent directories.
	 *
	 * @param content    the document content
	 * @param targetFile the file to write; an existing file is overwritten
	 * @throws IOException if an I/O error occurs while creating directories or writing the file
	 */
	public void write(
		@Nonnull final String content,
		@Nonnull final Path targetFile
	) throws IOException {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(absolute, content, StandardCharsets.UTF_8);
	}
}
