package com.wickscan.execution.journal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Base type of trade log entries.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TradeOpenEvent.class, name = "open"),
    @JsonSubTypes.Type(value = TradeUpdateEvent.class, name = "update"),
    @JsonSubTypes.Type(value = TradeCloseEvent.class, name = "close")
})
public abstract class TradeEvent {
    private Instant timestamp;
    private String signalId;
    private String symbol;

    protected TradeEvent() {
    }

    protected TradeEvent(Instant timestamp, String signalId, String symbol) {
        this.timestamp = timestamp;
        this.signalId = signalId;
        this.symbol = symbol;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSignalId() {
        return signalId;
    }

    public String getSymbol() {
        return symbol;
    }

    public abstract String getEventType();

    /**
     * Identifies the event within its signal; a second event with the same key is a duplicate.
     */
    @JsonIgnore
    public abstract String getEventKey();

    @JsonIgnore
    public abstract String getSummary();

    @JsonIgnore
    public String dedupKey() {
        return signalId + "|" + getEventType() + "|" + getEventKey();
    }
}
