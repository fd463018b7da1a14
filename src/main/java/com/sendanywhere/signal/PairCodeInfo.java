package com.sendanywhere.signal;

/**
 * Result of issuing a pairing code. {@code expiresIn} is in seconds.
 */
public record PairCodeInfo(String code, String transferId, long expiresIn) {}
