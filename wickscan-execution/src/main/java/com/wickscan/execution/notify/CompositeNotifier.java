package com.wickscan.execution.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans a message out to several notifiers; one failing channel does not affect the others.
 */
public class CompositeNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(CompositeNotifier.class);

    private final List<Notifier> delegates;

    public CompositeNotifier(List<Notifier> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void send(String text) {
        for (Notifier n : delegates) {
            try {
                n.send(text);
            } catch (RuntimeException e) {
                log.error("Notifier {} failed", n.getClass().getSimpleName(), e);
            }
        }
    }

    @Override
    public void close() {
        delegates.forEach(Notifier::close);
    }

    public List<Notifier> getDelegates() {
        return delegates;
    }
}
