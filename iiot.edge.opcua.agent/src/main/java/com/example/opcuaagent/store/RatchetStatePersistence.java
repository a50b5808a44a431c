package com.example.opcuaagent.store;

import java.util.Optional;

import com.example.opcuaagent.exceptions.PersistenceException;

/**
 * Durable key-value storage of ratchet state, keyed by device id.
 */
public interface RatchetStatePersistence extends AutoCloseable {

    /**
     * @return the last stored state of the device, empty if none was ever stored
     * @throws PersistenceException if stored state exists but cannot be read
     */
    Optional<DeviceRatchetState> load(String deviceId) throws PersistenceException;

    /**
     * Replaces the state of {@code state.getDeviceId()}. When this returns, the state survives a
     * crash; when it throws, the previously stored state is still intact.
     *
     * @throws PersistenceException if the state could not be durably written
     */
    void store(DeviceRatchetState state) throws PersistenceException;

    /**
     * Releases the storage. The instance must not be used afterwards.
     */
    @Override
    void close();
}
