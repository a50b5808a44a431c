package com.example.opcuaagent.store;

import com.example.opcuaagent.crypto.MessageKeys;
import com.example.opcuaagent.exceptions.CryptoException;

/**
 * Checks and decrypts one inbound message with the keys of its claimed index. The index is
 * only recorded as accepted if this returns normally.
 *
 * @param <T> the decrypted result
 */
@FunctionalInterface
public interface InboundVerifier<T> {

    T verify(MessageKeys keys, byte[] signingPublicKey) throws CryptoException;
}
