package com.sendanywhere.signal;

public record HubStats(int activePairs, int totalPairCodes, int activeConnections) {}
