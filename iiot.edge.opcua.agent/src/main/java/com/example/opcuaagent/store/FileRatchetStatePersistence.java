package com.example.opcuaagent.store;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.exceptions.PersistenceException;

/**
 * Stores one JSON file per device in a state directory.
 * <p>
 * A write goes to a temporary file in the same directory, is forced to disk and then moved
 * over the previous file atomically, so a crash leaves either the old or the new state. The
 * rename itself is made durable by forcing the directory, where the platform allows it.
 * <p>
 * The instance holds an exclusive lock on {@code .lock} in the directory until {@link #close()},
 * so no two processes (or two instances in one process) ever write the same state.
 */
public class FileRatchetStatePersistence implements RatchetStatePersistence {

    static final String LOCK_FILE = ".lock";

    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final Path directory;
    private final FileChannel lockChannel;
    private final FileLock lock;
    private final boolean directorySync;

    /**
     * @param directory state directory, created if it does not exist
     * @throws PersistenceException if the directory cannot be created, or
     *                              ({@link ExceptionContext#STATE_LOCKED}) if it is in use
     */
    public FileRatchetStatePersistence(Path directory) throws PersistenceException {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
            lockChannel = FileChannel.open(directory.resolve(LOCK_FILE), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new PersistenceException(ExceptionContext.PERSIST_WRITE, "Cannot create " + directory, e);
        }
        lock = acquire(lockChannel, directory);
        directorySync = supportsDirectorySync();
    }

    private static FileLock acquire(FileChannel channel, Path directory) throws PersistenceException {
        FileLock acquired;
        try {
            acquired = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            acquired = null;
        } catch (IOException e) {
            closeQuietly(channel, e);
            throw new PersistenceException(ExceptionContext.STATE_LOCKED, directory.toString(), e);
        }
        if (acquired == null) {
            closeQuietly(channel, null);
            throw new PersistenceException(ExceptionContext.STATE_LOCKED, directory.toString());
        }
        return acquired;
    }

    private static void closeQuietly(FileChannel channel, Exception failure) {
        try {
            channel.close();
        } catch (IOException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            }
        }
    }

    private boolean supportsDirectorySync() {
        try {
            syncDirectory();
            return true;
        } catch (IOException e) {
            logger.warn("Cannot sync state directory {} on this platform ({}); renames are not forced to disk",
                    directory, e.toString());
            return false;
        }
    }

    private void syncDirectory() throws IOException {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        }
    }

    @Override
    public Optional<DeviceRatchetState> load(String deviceId) throws PersistenceException {
        Path file = fileOf(deviceId);
        try {
            byte[] json = Files.readAllBytes(file);
            return Optional.of(RatchetStateMapper.read(json));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new PersistenceException(ExceptionContext.PERSIST_READ, file.toString(), e);
        }
    }

    @Override
    public void store(DeviceRatchetState state) throws PersistenceException {
        if (!lock.isValid()) {
            throw new PersistenceException(ExceptionContext.PERSIST_WRITE, "State directory " + directory + " was closed.");
        }
        Path file = fileOf(state.getDeviceId());
        Path temp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
        try {
            byte[] json = RatchetStateMapper.write(state);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            if (directorySync) {
                syncDirectory();
            }
            logger.debug("Stored ratchet state of {} to {}", state.getDeviceId(), file);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new PersistenceException(ExceptionContext.PERSIST_WRITE, file.toString(), e);
        }
    }

    @Override
    public void close() {
        try {
            lockChannel.close();
            logger.debug("Released state directory {}", directory);
        } catch (IOException e) {
            logger.warn("Failed to release the lock on {}", directory, e);
        }
    }

    /**
     * @return the state file of a device; the id is URL encoded so any device id is a safe file name
     */
    Path fileOf(String deviceId) {
        return directory.resolve(URLEncoder.encode(deviceId, StandardCharsets.UTF_8) + SUFFIX);
    }

    boolean isDirectorySynced() {
        return directorySync;
    }
}
