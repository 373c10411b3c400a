package com.refharvest.core.error;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/** 디렉터리 생성/파일 쓰기 실패. */
public class FilesystemFailureException extends HarvestException {
    private final Path path;

    public FilesystemFailureException(URI resource, Path path, IOException cause) {
        super(resource, "cannot write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() { return path; }
}
