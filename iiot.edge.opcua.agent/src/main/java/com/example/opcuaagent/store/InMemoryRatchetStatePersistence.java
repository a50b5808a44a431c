package com.example.opcuaagent.store;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.exceptions.PersistenceException;

/**
 * Keeps serialized state in memory. A second store opened on the same instance behaves like a
 * restarted process. Writes can be made to fail to simulate a full or broken disk.
 */
public class InMemoryRatchetStatePersistence implements RatchetStatePersistence {

    private final Map<String, byte[]> records = new ConcurrentHashMap<>();
    private final AtomicBoolean failWrites = new AtomicBoolean(false);
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public Optional<DeviceRatchetState> load(String deviceId) throws PersistenceException {
        byte[] json = records.get(deviceId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(RatchetStateMapper.read(json));
        } catch (IOException e) {
            throw new PersistenceException(ExceptionContext.PERSIST_READ, deviceId, e);
        }
    }

    @Override
    public void store(DeviceRatchetState state) throws PersistenceException {
        if (failWrites.get()) {
            throw new PersistenceException(ExceptionContext.PERSIST_WRITE, "Write failure for " + state.getDeviceId());
        }
        try {
            records.put(state.getDeviceId(), RatchetStateMapper.write(state));
            writes.incrementAndGet();
        } catch (IOException e) {
            throw new PersistenceException(ExceptionContext.PERSIST_WRITE, state.getDeviceId(), e);
        }
    }

    @Override
    public void close() {
        // records outlive the stores opened on this instance
    }

    public void setFailWrites(boolean fail) {
        failWrites.set(fail);
    }

    public int getWriteCount() {
        return writes.get();
    }
}
