package com.sendanywhere.signal;

import com.fasterxml.jackson.databind.JsonNode;
import com.sendanywhere.config.Json;
import com.sendanywhere.error.ErrorCategory;
import com.sendanywhere.error.NotFoundException;
import com.sendanywhere.error.NotFoundReason;
import com.sendanywhere.error.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Issues short-lived pairing codes, pairs one sender with one receiver per
 * code and relays their messages.
 *
 * Both tables (codes and rooms) are guarded by one lock. Frames are collected
 * while the lock is held and sent after it is released, so a slow or dead peer
 * never blocks other rooms. Expired codes are purged lazily, whenever a code is
 * issued, looked up, connected to, or stats are read.
 */
public class SignalingHub {

    private static final Logger log = LoggerFactory.getLogger(SignalingHub.class);

    private static final class PairEntry {
        final String transferId;
        final JsonNode manifest;
        final Instant createdAt;
        PairStatus status = PairStatus.WAITING;

        PairEntry(String transferId, JsonNode manifest, Instant createdAt) {
            this.transferId = transferId;
            this.manifest = manifest;
            this.createdAt = createdAt;
        }
    }

    /** A frame to send once the lock is released. {@code onFailure} is told if it cannot be. */
    private record Delivery(SignalPeer to, String text, SignalPeer onFailure) {}

    private final int codeLength;
    private final Duration ttl;
    private final Clock clock;
    private final Random random;

    private final Object lock = new Object();
    private final Map<String, PairEntry> codes = new HashMap<>();
    private final Map<String, EnumMap<Role, SignalPeer>> rooms = new HashMap<>();

    public SignalingHub(int codeLength, Duration ttl) {
        this(codeLength, ttl, Clock.systemUTC(), new SecureRandom());
    }

    public SignalingHub(int codeLength, Duration ttl, Clock clock, Random random) {
        if (codeLength < 1 || codeLength > 18) {
            throw new IllegalArgumentException("codeLength must be 1..18: " + codeLength);
        }
        this.codeLength = codeLength;
        this.ttl = ttl;
        this.clock = clock;
        this.random = random;
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Issue a fresh code for {@code transferId}. The code never collides with a
     * live one.
     */
    public PairCodeInfo issuePairCode(String transferId, JsonNode manifest) throws TransferException {
        if (transferId == null || transferId.isBlank()) {
            throw TransferException.invalidInput("Missing transfer id");
        }
        if (manifest == null || manifest.isNull() || manifest.isMissingNode()) {
            throw TransferException.invalidInput("Missing manifest");
        }
        String code;
        synchronized (lock) {
            purgeExpiredLocked();
            if (codes.size() >= codeSpace()) {
                throw new TransferException(ErrorCategory.EXHAUSTED, "No free pairing codes of length " + codeLength);
            }
            do {
                code = nextCode();
            } while (codes.containsKey(code));
            codes.put(code, new PairEntry(transferId, manifest, clock.instant()));
        }
        log.info("Issued pair code {} for transfer {}", code, transferId);
        return new PairCodeInfo(code, transferId, ttl.toSeconds());
    }

    public PairInfo getInfo(String code) throws NotFoundException {
        synchronized (lock) {
            purgeExpiredLocked();
            PairEntry entry = codes.get(code);
            if (entry == null) {
                throw new NotFoundException(NotFoundReason.PAIR_CODE_UNKNOWN, "Pair code not found or expired");
            }
            return new PairInfo(code, entry.transferId, entry.manifest, entry.status, remainingSeconds(entry));
        }
    }

    /**
     * Register {@code peer} under {@code role} in the room for {@code code}. A
     * reconnect on the same role replaces (and closes) the earlier connection.
     * An unknown code or role gets an error frame and the peer is closed.
     *
     * @return true if the peer was registered
     */
    public boolean connect(String code, String roleName, SignalPeer peer) {
        Role role = Role.fromWireName(roleName);
        List<Delivery> deliveries = new ArrayList<>();
        SignalPeer replaced = null;
        String rejection = null;

        synchronized (lock) {
            purgeExpiredLocked();
            PairEntry entry = codes.get(code);
            if (entry == null) {
                rejection = SignalFrames.INVALID_CODE;
            } else if (role == null) {
                rejection = SignalFrames.INVALID_ROLE;
            } else {
                EnumMap<Role, SignalPeer> room = rooms.computeIfAbsent(code, c -> new EnumMap<>(Role.class));
                replaced = room.put(role, peer);
                deliveries.add(new Delivery(peer, SignalFrames.connected(role, code), null));

                SignalPeer sender = room.get(Role.SENDER);
                SignalPeer receiver = room.get(Role.RECEIVER);
                if (sender != null && receiver != null) {
                    entry.status = PairStatus.PAIRED;
                    deliveries.add(new Delivery(sender, SignalFrames.peerConnected(Role.RECEIVER, null), null));
                    deliveries.add(new Delivery(receiver, SignalFrames.peerConnected(Role.SENDER, entry.manifest), null));
                }
            }
        }

        if (rejection != null) {
            log.info("Rejected connection to {} as '{}': {}", code, roleName, rejection);
            deliver(new Delivery(peer, SignalFrames.error(rejection), null));
            peer.close();
            return false;
        }

        if (replaced != null && replaced != peer) {
            log.info("Pair {}: {} reconnected, closing previous connection", code, role.wireName());
            replaced.close();
        }
        log.info("Pair {}: {} connected", code, role.wireName());
        deliveries.forEach(this::deliver);
        return true;
    }

    /**
     * Forward {@code text} verbatim to the opposite role. The text must be JSON;
     * its contents are not interpreted.
     */
    public void relay(String code, Role role, SignalPeer from, String text) {
        try {
            Json.mapper().readTree(text);
        } catch (IOException e) {
            log.debug("Pair {}: non-JSON message from {}: {}", code, role.wireName(), e.getMessage());
            deliver(new Delivery(from, SignalFrames.error(SignalFrames.INVALID_MESSAGE), null));
            return;
        }

        SignalPeer target;
        synchronized (lock) {
            EnumMap<Role, SignalPeer> room = rooms.get(code);
            target = room != null ? room.get(role.opposite()) : null;
        }

        if (target == null) {
            deliver(new Delivery(from, SignalFrames.error(SignalFrames.PEER_NOT_CONNECTED), null));
            return;
        }
        deliver(new Delivery(target, text, from));
    }

    /**
     * Remove {@code peer} from the room. A peer that was already replaced by a
     * reconnect is ignored. Empty rooms are dropped.
     */
    public void disconnect(String code, Role role, SignalPeer peer) {
        SignalPeer remaining;
        synchronized (lock) {
            EnumMap<Role, SignalPeer> room = rooms.get(code);
            if (room == null || room.get(role) != peer) {
                return;
            }
            room.remove(role);
            remaining = room.get(role.opposite());
            if (room.isEmpty()) {
                rooms.remove(code);
            }
        }
        log.info("Pair {}: {} disconnected", code, role.wireName());
        if (remaining != null) {
            deliver(new Delivery(remaining, SignalFrames.peerDisconnected(role), null));
        }
    }

    public HubStats stats() {
        synchronized (lock) {
            purgeExpiredLocked();
            int connections = 0;
            for (EnumMap<Role, SignalPeer> room : rooms.values()) {
                connections += room.size();
            }
            return new HubStats(rooms.size(), codes.size(), connections);
        }
    }

    /** Drop expired codes and their rooms now. @return number of codes removed */
    public int purgeExpired() {
        synchronized (lock) {
            return purgeExpiredLocked();
        }
    }

    private int purgeExpiredLocked() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<String, PairEntry>> it = codes.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, PairEntry> e = it.next();
            if (Duration.between(e.getValue().createdAt, now).compareTo(ttl) > 0) {
                it.remove();
                rooms.remove(e.getKey());
                removed++;
                log.debug("Pair code {} expired", e.getKey());
            }
        }
        return removed;
    }

    private long remainingSeconds(PairEntry entry) {
        long age = Duration.between(entry.createdAt, clock.instant()).toSeconds();
        return Math.max(0, ttl.toSeconds() - age);
    }

    private String nextCode() {
        StringBuilder sb = new StringBuilder(codeLength);
        for (int i = 0; i < codeLength; i++) {
            sb.append((char) ('0' + random.nextInt(10)));
        }
        return sb.toString();
    }

    private long codeSpace() {
        long space = 1;
        for (int i = 0; i < codeLength; i++) {
            space *= 10;
        }
        return space;
    }

    private void deliver(Delivery d) {
        try {
            d.to().send(d.text());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send frame to peer: {}", e.toString());
            if (d.onFailure() != null) {
                deliver(new Delivery(d.onFailure(), SignalFrames.error(SignalFrames.PEER_NOT_CONNECTED), null));
            }
        }
    }
}
