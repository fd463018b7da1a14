package com.sendanywhere.signal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sendanywhere.config.Json;

/**
 * The control frames the hub itself produces. Everything else on a pairing
 * channel is relayed untouched.
 */
public final class SignalFrames {

    public static final String CONNECTED = "connected";
    public static final String PEER_CONNECTED = "peer_connected";
    public static final String PEER_DISCONNECTED = "peer_disconnected";
    public static final String ERROR = "error";

    public static final String INVALID_CODE = "Invalid or expired pair code";
    public static final String INVALID_ROLE = "Invalid role. Must be 'sender' or 'receiver'";
    public static final String PEER_NOT_CONNECTED = "Peer not connected";
    public static final String INVALID_MESSAGE = "Invalid message: not JSON";

    private SignalFrames() {}

    public static String connected(Role role, String code) {
        return frame(CONNECTED)
                .put("role", role.wireName())
                .put("pair_code", code)
                .toString();
    }

    /**
     * @param manifest attached for the receiver only; null for the sender
     */
    public static String peerConnected(Role peerRole, JsonNode manifest) {
        ObjectNode node = frame(PEER_CONNECTED).put("peer_role", peerRole.wireName());
        if (manifest != null) {
            node.set("manifest", manifest);
        }
        return node.toString();
    }

    public static String peerDisconnected(Role peerRole) {
        return frame(PEER_DISCONNECTED).put("peer_role", peerRole.wireName()).toString();
    }

    public static String error(String message) {
        return frame(ERROR).put("message", message).toString();
    }

    private static ObjectNode frame(String type) {
        return Json.mapper().createObjectNode().put("type", type);
    }
}
