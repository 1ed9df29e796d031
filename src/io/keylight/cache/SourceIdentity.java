package io.keylight.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A source file and the modification time it had when it was read
 */
public record SourceIdentity(Path path, long modifiedMillis) {

    public static SourceIdentity of(Path path) throws IOException {
        return new SourceIdentity(path.toAbsolutePath().normalize(), Files.getLastModifiedTime(path).toMillis());
    }
}
