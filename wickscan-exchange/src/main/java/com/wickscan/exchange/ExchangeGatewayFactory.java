package com.wickscan.exchange;

import com.wickscan.exchange.binance.BinanceFuturesGateway;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.exchange.paper.PaperExchangeGateway;

public class ExchangeGatewayFactory {

    public static ExchangeGateway create(ExchangeConfig config) throws ExchangeException {
        String venue = config.getVenue();
        if (venue == null || venue.isBlank()) {
            throw new ExchangeException("No venue configured");
        }

        return switch (venue.toLowerCase()) {
            case "binance" -> new BinanceFuturesGateway(config);
            case "paper" -> new PaperExchangeGateway();
            default -> throw new ExchangeException("Unsupported venue: " + venue);
        };
    }
}
