package com.wickscan.execution.notify;

/**
 * Delivers a text message to subscribers. Fire-and-forget: implementations log failures and
 * never throw or retry.
 */
public interface Notifier {

    void send(String text);

    default void close() {
    }
}
