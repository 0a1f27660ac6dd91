package com.myla.channels;

import com.myla.shared.model.InboundMessage;

@FunctionalInterface
public interface MessageSink {
    void accept(InboundMessage message);
}
