package com.myla.channels;

import com.myla.shared.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live chat channels by id. Runs {@code onAllStopped} once the last open channel has stopped.
 */
public class ChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Map<String, ChannelAdapter> open = new ConcurrentHashMap<>();
    private final Runnable onAllStopped;

    public ChannelRegistry(Runnable onAllStopped) {
        this.onAllStopped = onAllStopped;
    }

    public void open(ChannelAdapter adapter, MessageSink sink) {
        if (open.putIfAbsent(adapter.id(), adapter) != null) {
            throw new IllegalArgumentException("Channel already open: " + adapter.id());
        }
        adapter.start(sink);
        log.info("Channel {} opened", adapter.id());
    }

    /** Sends {@code content} back on the channel a message arrived from; ignored if it has closed. */
    public void reply(String channelId, String content) {
        var adapter = open.get(channelId);
        if (adapter == null) {
            log.debug("Dropping reply for closed channel {}", channelId);
            return;
        }
        adapter.send(new OutboundMessage(channelId, content, Map.of()));
    }

    public void closed(String channelId) {
        if (open.remove(channelId) != null && open.isEmpty()) {
            log.info("Last channel closed");
            onAllStopped.run();
        }
    }

    public void closeAll() {
        open.values().forEach(ChannelAdapter::stop);
        open.clear();
    }

    public boolean isOpen(String channelId) {
        return open.containsKey(channelId);
    }
}
