package dbft.consensus.persistence;

import dbft.common.util.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One directory per column, one file per key (hex file name). A write goes to a temp file in the
 * same directory and is moved over the old row, so a crash leaves either the old or the new row.
 */
public final class FileColumnStore implements ColumnStore {
    private static final Logger log = LoggerFactory.getLogger(FileColumnStore.class);

    private final Path root;
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    public FileColumnStore(Path root) throws IOException {
        this.root = root;
        Files.createDirectories(root);
    }

    @Override
    public void put(String column, byte[] key, byte[] value) throws IOException {
        rw.writeLock().lock();
        try {
            Path dir = root.resolve(column);
            Files.createDirectories(dir);
            Path target = dir.resolve(Hex.toHex(key));
            Path tmp = Files.createTempFile(dir, ".row", ".tmp");
            try {
                Files.write(tmp, value, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    log.debug("Atomic move unsupported under {}, falling back to replace", dir);
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public Optional<byte[]> get(String column, byte[] key) throws IOException {
        rw.readLock().lock();
        try {
            return Optional.of(Files.readAllBytes(root.resolve(column).resolve(Hex.toHex(key))));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public void delete(String column, byte[] key) throws IOException {
        rw.writeLock().lock();
        try {
            Files.deleteIfExists(root.resolve(column).resolve(Hex.toHex(key)));
        } finally {
            rw.writeLock().unlock();
        }
    }

    public Path root() { return root; }
}
