package com.example.opcuaagent.store;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.crypto.Base64Text;
import com.example.opcuaagent.crypto.MegolmRatchet;
import com.example.opcuaagent.crypto.MessageKeys;
import com.example.opcuaagent.crypto.SessionKey;
import com.example.opcuaagent.crypto.SigningKey;
import com.example.opcuaagent.exceptions.CryptoException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.exceptions.PersistenceException;

/**
 * Owns the Megolm sessions of all devices.
 * <p>
 * Every operation on a device runs under that device's lock, so operations on unrelated
 * devices never wait for each other. State is loaded lazily on first use and written through
 * the {@link RatchetStatePersistence} before any key material leaves the store. Failed writes
 * are not rolled back in memory: a step whose write failed is discarded and the next call
 * moves on to the following index, so an index is never used twice.
 * <p>
 * A store assumes it is the only writer of its persistence; {@link #close()} releases it.
 */
public class RatchetSessionStore implements AutoCloseable {

    /** Outbound sessions rotate before the counter would wrap around. */
    static final long MAX_INDEX = 0xFFFFFFFFL;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final RatchetStatePersistence persistence;
    private final SecureRandom random;
    private final ConcurrentMap<String, DeviceSlot> slots = new ConcurrentHashMap<>();

    public RatchetSessionStore(RatchetStatePersistence persistence) {
        this(persistence, new SecureRandom());
    }

    public RatchetSessionStore(RatchetStatePersistence persistence, SecureRandom random) {
        this.persistence = persistence;
        this.random = random;
    }

    /**
     * Hands out the keys of the next outbound index of a device, creating its session on first use.
     *
     * @param deviceId device to encrypt for
     * @return keys and signer of exactly one message
     * @throws PersistenceException if the advanced ratchet could not be persisted; no keys are returned then
     */
    public OutboundStep advanceOutbound(String deviceId) throws PersistenceException {
        DeviceSlot slot = slotOf(deviceId);
        slot.lock.lock();
        try {
            DeviceRatchetState state = loaded(slot);
            OutboundSessionState outbound = state.getOutbound();
            if (outbound == null) {
                outbound = newOutboundSession(state);
            } else if (outbound.getNextIndex() >= MAX_INDEX) {
                logger.warn("Outbound session {} of {} is exhausted, rotating", outbound.getSessionId(), deviceId);
                outbound = newOutboundSession(state);
            }

            MegolmRatchet ratchet = MegolmRatchet.fromBytes(Base64Text.decode(outbound.getRatchet()), outbound.getNextIndex());
            long index = ratchet.getIndex();
            MessageKeys keys = ratchet.deriveKeys();
            ratchet.advance();

            outbound.setRatchet(Base64Text.encode(ratchet.toBytes()));
            outbound.setNextIndex(ratchet.getIndex());
            persistence.store(state);

            return new OutboundStep(outbound.getSessionId(), index,
                    keys, SigningKey.fromSeed(Base64Text.decode(outbound.getSigningKey())));
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Accepts one inbound message. The verifier runs under the device lock; only when it succeeds
     * is the index recorded, so a forged or replayed message leaves the chain untouched.
     *
     * @param deviceId  device whose state holds the inbound chain
     * @param sessionId sender session id claimed by the message
     * @param index     ratchet index claimed by the message
     * @param verifier  MAC, signature and decryption check
     * @return what the verifier returned
     * @throws CryptoException      for an unknown session, a replayed or earlier index, or a failed verification
     * @throws PersistenceException if the accepted index could not be persisted
     */
    public <T> T acceptInbound(String deviceId, String sessionId, long index, InboundVerifier<T> verifier)
            throws CryptoException, PersistenceException {
        DeviceSlot slot = slotOf(deviceId);
        slot.lock.lock();
        try {
            DeviceRatchetState state = loaded(slot);
            InboundChainState chain = state.findInbound(sessionId);
            if (chain == null) {
                throw new CryptoException(ExceptionContext.UNKNOWN_SESSION, "Session " + sessionId + " of " + deviceId + ".");
            }
            if (index < chain.getNextIndex()) {
                throw new CryptoException(ExceptionContext.REPLAY,
                        "Index " + index + " of session " + sessionId + ", next acceptable is " + chain.getNextIndex() + ".");
            }
            if (index >= MAX_INDEX) {
                throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, "Index " + index + " is out of range.");
            }

            MegolmRatchet ratchet = MegolmRatchet.fromBytes(Base64Text.decode(chain.getRatchet()), chain.getNextIndex());
            ratchet.advanceTo(index);
            T result = verifier.verify(ratchet.deriveKeys(), Base64Text.decode(chain.getSigningPublicKey()));

            ratchet.advance();
            chain.setRatchet(Base64Text.encode(ratchet.toBytes()));
            chain.setNextIndex(ratchet.getIndex());
            chain.setLastAcceptedIndex(index);
            persistence.store(state);
            return result;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Creates the outbound session of a device unless one exists.
     *
     * @return the id of the device's outbound session
     */
    public String createOutbound(String deviceId) throws PersistenceException {
        DeviceSlot slot = slotOf(deviceId);
        slot.lock.lock();
        try {
            DeviceRatchetState state = loaded(slot);
            if (state.getOutbound() != null) {
                return state.getOutbound().getSessionId();
            }
            OutboundSessionState outbound = newOutboundSession(state);
            persistence.store(state);
            return outbound.getSessionId();
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Replaces the outbound session of a device. The old session is never used for encryption
     * again; its inbound chain stays so earlier messages remain decryptable.
     *
     * @return the id of the new session
     */
    public String rotateOutbound(String deviceId) throws PersistenceException {
        DeviceSlot slot = slotOf(deviceId);
        slot.lock.lock();
        try {
            DeviceRatchetState state = loaded(slot);
            String previous = state.getOutbound() == null ? null : state.getOutbound().getSessionId();
            OutboundSessionState outbound = newOutboundSession(state);
            persistence.store(state);
            logger.info("Rotated outbound session of {} from {} to {}", deviceId, previous, outbound.getSessionId());
            return outbound.getSessionId();
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * @return the session key of the device's outbound session at its next index
     * @throws CryptoException if the device has no outbound session
     */
    public String exportSessionKey(String deviceId) throws CryptoException, PersistenceException {
        DeviceSlot slot = slotOf(deviceId);
        slot.lock.lock();
        try {
            OutboundSessionState outbound = loaded(slot).getOutbound();
            if (outbound == null) {
                throw new CryptoException(ExceptionContext.NO_OUTBOUND_SESSION, deviceId);
            }
            MegolmRatchet ratchet = MegolmRatchet.fromBytes(Base64Text.decode(outbound.getRatchet()), outbound.getNextIndex());
            return SessionKey.export(ratchet, SigningKey.fromSeed(Base64Text.decode(outbound.getSigningKey())));
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Adds the inbound chain described by a session key. A chain already known for the same
     * session is kept as it is.
     *
     * @return the session id of the key
     * @throws CryptoException if the key is malformed or its signature does not verify
     */
    public String importSessionKey(String deviceId, String sessionKey) throws CryptoException, PersistenceException {
        SessionKey key = SessionKey.parse(sessionKey);
        String sessionId = key.getSessionId();

        DeviceSlot slot = slotOf(deviceId);
        slot.lock.lock();
        try {
            DeviceRatchetState state = loaded(slot);
            if (state.findInbound(sessionId) != null) {
                logger.info("Session {} is already known for {}, keeping the existing chain", sessionId, deviceId);
                return sessionId;
            }
            InboundChainState chain = new InboundChainState();
            chain.setSessionId(sessionId);
            chain.setNextIndex(key.getIndex());
            chain.setRatchet(Base64Text.encode(key.toRatchet().toBytes()));
            chain.setSigningPublicKey(Base64Text.encode(key.getSigningPublicKey()));
            state.getInbound().add(chain);
            persistence.store(state);
            logger.info("Imported session {} for {} starting at index {}", sessionId, deviceId, key.getIndex());
            return sessionId;
        } finally {
            slot.lock.unlock();
        }
    }

    public SessionSummary describe(String deviceId) throws PersistenceException {
        DeviceSlot slot = slotOf(deviceId);
        slot.lock.lock();
        try {
            DeviceRatchetState state = loaded(slot);
            List<SessionSummary.Inbound> inbound = new ArrayList<>();
            for (InboundChainState chain : state.getInbound()) {
                inbound.add(new SessionSummary.Inbound(chain.getSessionId(), chain.getNextIndex(), chain.getLastAcceptedIndex()));
            }
            OutboundSessionState outbound = state.getOutbound();
            return new SessionSummary(deviceId,
                    outbound == null ? null : outbound.getSessionId(),
                    outbound == null ? 0L : outbound.getNextIndex(),
                    inbound);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Creates a fresh outbound session and registers its inbound chain, so messages of the
     * device can be decrypted with the same state.
     */
    private OutboundSessionState newOutboundSession(DeviceRatchetState state) {
        byte[] seed = new byte[MegolmRatchet.LENGTH];
        random.nextBytes(seed);
        SigningKey signingKey = SigningKey.generate(random);
        String sessionId = Base64Text.encode(signingKey.getPublicKey());

        OutboundSessionState outbound = new OutboundSessionState();
        outbound.setSessionId(sessionId);
        outbound.setNextIndex(0L);
        outbound.setRatchet(Base64Text.encode(seed));
        outbound.setSigningKey(Base64Text.encode(signingKey.getSeed()));
        outbound.setCreatedAt(Instant.now().toString());
        state.setOutbound(outbound);

        InboundChainState chain = new InboundChainState();
        chain.setSessionId(sessionId);
        chain.setNextIndex(0L);
        chain.setRatchet(outbound.getRatchet());
        chain.setSigningPublicKey(sessionId);
        state.getInbound().add(chain);

        logger.info("Created outbound session {} for {}", sessionId, state.getDeviceId());
        return outbound;
    }

    /**
     * Releases the persistence. The store must not be used afterwards.
     */
    @Override
    public void close() {
        persistence.close();
    }

    private DeviceSlot slotOf(String deviceId) {
        return slots.computeIfAbsent(deviceId, DeviceSlot::new);
    }

    private DeviceRatchetState loaded(DeviceSlot slot) throws PersistenceException {
        if (slot.state == null) {
            Optional<DeviceRatchetState> stored = persistence.load(slot.deviceId);
            slot.state = stored.orElseGet(() -> new DeviceRatchetState(slot.deviceId));
            if (stored.isPresent()) {
                logger.debug("Loaded ratchet state of {}", slot.deviceId);
            }
        }
        return slot.state;
    }

    private static final class DeviceSlot {
        private final String deviceId;
        private final ReentrantLock lock = new ReentrantLock();

        /** Guarded by {@link #lock}. */
        private DeviceRatchetState state;

        DeviceSlot(String deviceId) {
            this.deviceId = deviceId;
        }
    }
}
