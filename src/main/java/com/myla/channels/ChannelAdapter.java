package com.myla.channels;

import com.myla.shared.model.OutboundMessage;

public interface ChannelAdapter {
    String id();
    void start(MessageSink sink);
    void send(OutboundMessage msg);
    void stop();
}
