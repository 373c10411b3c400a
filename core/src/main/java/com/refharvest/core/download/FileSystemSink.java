package com.refharvest.core.download;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/** 출력 디렉터리 아래에 저장. name.part 에 쓴 뒤 원자적으로 이동한다. */
public final class FileSystemSink implements ResourceSink {

    private final Path root;

    public FileSystemSink(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path getRoot() { return root; }

    /** 이름 → 실제 경로. 루트 밖으로 벗어나면 IOException. */
    public Path resolve(String name) throws IOException {
        Path p = root.resolve(name).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new IOException("name escapes output directory: " + name);
        }
        return p;
    }

    @Override
    public boolean exists(String name) {
        try {
            Path p = resolve(name);
            return Files.isRegularFile(p) && Files.size(p) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public long write(String name, InputStream body, int chunkSize) throws IOException {
        Path target = resolve(name);
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);

        Path part = target.resolveSibling(target.getFileName() + ".part");
        long total = 0;
        try {
            try (OutputStream out = Files.newOutputStream(part)) {
                byte[] buf = new byte[Math.max(512, chunkSize)];
                int n;
                while ((n = body.read(buf)) != -1) {
                    out.write(buf, 0, n);
                    total += n;
                }
            }
            move(part, target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(part);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        return total;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
