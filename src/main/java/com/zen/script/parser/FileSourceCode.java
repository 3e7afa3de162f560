package com.zen.script.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Source text loaded from a .zen file. */
public final class FileSourceCode extends AbstractSourceCode {
    private final Path path;

    public FileSourceCode(Path path, String text) {
        super(text);
        this.path = path;
    }

    public static FileSourceCode read(Path path) throws IOException {
        return new FileSourceCode(path, Files.readString(path, StandardCharsets.UTF_8));
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getName() {
        return path.toString();
    }
}
