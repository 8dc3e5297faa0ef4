package ai.navigator.repl;

/**
 * A file a REPL value was derived from, with the file's modification time when it was read.
 *
 * @param path slash-separated path relative to the project root
 * @param mtime epoch millis at capture time
 */
public record Dependency(String path, long mtime) {}
