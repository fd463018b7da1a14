package com.sendanywhere.signal;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a receiver learns by resolving a pairing code. The manifest is kept as
 * the sender supplied it.
 */
public record PairInfo(String code, String transferId, JsonNode manifest, PairStatus status, long expiresIn) {}
