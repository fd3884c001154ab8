package com.example.gamesession.ws.message;

import com.example.gamesession.ws.OutboundMessageType;

/** 送信エンベロープ {"type": ..., "payload": {...}}。 */
public record OutboundMessage(OutboundMessageType type, Object payload) {}
