package com.myla.shared.model;

import java.time.Instant;

public record InboundMessage(
    String senderId,
    String channelId,
    String content,
    Instant timestamp
) {}
