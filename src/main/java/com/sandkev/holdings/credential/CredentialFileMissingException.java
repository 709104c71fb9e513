package com.sandkev.holdings.credential;

import java.nio.file.Path;

/** The credential file existed at load time but is gone when a mutation is attempted. */
public class CredentialFileMissingException extends RuntimeException {

    private final Path path;

    public CredentialFileMissingException(Path path) {
        super("The secret file can not be found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
