package ai.tiles.strategy;

import java.nio.file.Path;

/**
 * Outcome of {@link Strategy#save(Path)} or {@link Strategy#load(Path)}.
 * <p>
 * Persistence failures never propagate as exceptions; the status distinguishes a missing file
 * from corrupt content so the caller can decide whether to retry or fall back to an untrained
 * strategy.
 */
public final class PersistenceResult {

    public enum Status {
        OK,
        FILE_MISSING,
        CORRUPT_DATA,
        IO_ERROR,
        UNSUPPORTED
    }

    private final Status status;
    private final Path path;
    private final String message;

    private PersistenceResult(Status status, Path path, String message) {
        this.status = status;
        this.path = path;
        this.message = message;
    }

    public static PersistenceResult ok(Path path) {
        return new PersistenceResult(Status.OK, path, "OK");
    }

    public static PersistenceResult fileMissing(Path path) {
        return new PersistenceResult(Status.FILE_MISSING, path, "File not found: " + path);
    }

    public static PersistenceResult corrupt(Path path, String detail) {
        return new PersistenceResult(Status.CORRUPT_DATA, path, "Corrupt data in " + path + ": " + detail);
    }

    public static PersistenceResult ioError(Path path, String detail) {
        return new PersistenceResult(Status.IO_ERROR, path, "I/O error on " + path + ": " + detail);
    }

    public static PersistenceResult unsupported(String strategyName) {
        return new PersistenceResult(Status.UNSUPPORTED, null, strategyName + " has no persistent state");
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }

    public Status getStatus() {
        return status;
    }

    public Path getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "PersistenceResult(" + status + ", " + message + ")";
    }
}
