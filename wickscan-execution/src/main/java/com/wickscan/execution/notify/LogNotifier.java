package com.wickscan.execution.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log; the fallback when no channel is configured.
 */
public class LogNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LogNotifier.class);

    @Override
    public void send(String text) {
        log.info("[notify] {}", text.replace('\n', ' '));
    }
}
