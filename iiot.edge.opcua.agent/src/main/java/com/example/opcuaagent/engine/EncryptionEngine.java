package com.example.opcuaagent.engine;

import com.example.opcuaagent.exceptions.CryptoException;
import com.example.opcuaagent.exceptions.PersistenceException;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.model.TelemetryEnvelope;

/**
 * Turns an envelope or status update into the payload published for it.
 */
public interface EncryptionEngine {

    /**
     * @return the MQTT payload of the envelope
     * @throws PersistenceException if key material could not be durably advanced; nothing may be published then
     * @throws CryptoException      if the envelope cannot be protected
     */
    byte[] protect(TelemetryEnvelope envelope) throws PersistenceException, CryptoException;

    /**
     * @return the MQTT payload of the status update
     * @throws PersistenceException if key material could not be durably advanced; nothing may be published then
     * @throws CryptoException      if the update cannot be protected
     */
    byte[] protect(StatusUpdate update) throws PersistenceException, CryptoException;

    /**
     * @return true if payloads produced by this engine are encrypted
     */
    boolean isEncrypting();
}
