package com.sendanywhere.signal;

import java.io.IOException;

/**
 * One live connection registered in a room. The hub only ever sends it text
 * frames and closes it.
 */
public interface SignalPeer {

    void send(String text) throws IOException;

    void close();
}
