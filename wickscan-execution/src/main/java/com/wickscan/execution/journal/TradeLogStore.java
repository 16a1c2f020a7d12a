package com.wickscan.execution.journal;

/**
 * Append-only store of trade events. Recording the same event twice is a no-op.
 * Implementations log failures instead of throwing.
 */
public interface TradeLogStore {

    void recordOpen(TradeOpenEvent event);

    void recordUpdate(TradeUpdateEvent event);

    void recordClose(TradeCloseEvent event);

    TradeLogStore NONE = new TradeLogStore() {
        @Override
        public void recordOpen(TradeOpenEvent event) {
        }

        @Override
        public void recordUpdate(TradeUpdateEvent event) {
        }

        @Override
        public void recordClose(TradeCloseEvent event) {
        }
    };
}
