package works.scenegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * The text of one generated compilation unit.
 */
public record GeneratedSource(String packageName, String className, String text) {
	public GeneratedSource {
		requireNonNull(packageName);
		requireNonNull(className);
		requireNonNull(text);
	}

	/**
	 * @return {@code <package dirs>/<className>.java}
	 */
	public Path relativePath() {
		Path result = Path.of(className + ".java");
		if (packageName.isEmpty()) {
			return result;
		}
		return Path.of("", packageName.split("\\.")).resolve(result);
	}

	/**
	 * Writes the source under {@code sourceRoot}, replacing any existing file,
	 * and creating directories as needed.
	 *
	 * @return the file written
	 */
	public Path writeTo(Path sourceRoot) throws IOException {
		Path file = sourceRoot.resolve(relativePath());
		Path dir = file.getParent();
		if (dir != null) {
			Files.createDirectories(dir);
		}
		Files.writeString(file, text, UTF_8);
		return file;
	}
}
