package com.wickscan.execution.notify;

import com.wickscan.core.model.Side;
import com.wickscan.execution.position.DcaState;
import com.wickscan.execution.position.LifecycleUpdate;
import com.wickscan.execution.position.Position;

import java.time.Duration;
import java.util.Locale;

/**
 * Renders position events as short HTML messages (Telegram parse mode).
 */
public final class NotificationFormatter {

    private NotificationFormatter() {}

    /**
     * Price with precision by magnitude: 6 decimals below 0.01, 5 below 1, otherwise 4.
     */
    public static String price(double value) {
        if (!Double.isFinite(value)) {
            return "-";
        }
        double abs = Math.abs(value);
        if (abs < 0.01) {
            return String.format(Locale.ROOT, "%.6f", value);
        }
        if (abs < 1) {
            return String.format(Locale.ROOT, "%.5f", value);
        }
        return String.format(Locale.ROOT, "%.4f", value);
    }

    public static String opened(String strategy, Position p) {
        StringBuilder sb = new StringBuilder();
        sb.append(arrow(p.getSide())).append(" <b>").append(p.getSide()).append(' ').append(escape(p.getSymbol()))
            .append("</b> opened [").append(escape(strategy)).append("]\n");
        sb.append("Entry: ").append(price(p.getEntryPrice())).append('\n');
        if (p.isAveraging()) {
            DcaState dca = p.getDca();
            sb.append("Step 1/").append(dca.getLevels())
                .append(" margin ").append(usd(dca.cumulativeMargin())).append('\n');
            sb.append("TP: ").append(price(p.getTakeProfit())).append('\n');
            sb.append("Next step: ").append(price(dca.nextLadderPrice()));
        } else {
            sb.append("SL: ").append(price(p.getStopLoss()))
                .append(" | TP: ").append(price(p.getTakeProfit())).append('\n');
            sb.append(String.format(Locale.ROOT, "Score %.2f / threshold %.2f | x%d %s",
                p.getScore(), p.getThreshold(), p.getLeverage(), usd(p.getNotionalUsd())));
        }
        return sb.toString();
    }

    public static String closed(Position p) {
        String icon = p.getRealizedPnlUsd() >= 0 ? "✅" : "❌";
        StringBuilder sb = new StringBuilder();
        sb.append(icon).append(" <b>").append(p.getSide()).append(' ').append(escape(p.getSymbol()))
            .append("</b> closed: ").append(p.getExitReason()).append('\n');
        sb.append("Entry ").append(price(p.basePrice())).append(" → exit ").append(price(p.getExitPrice())).append('\n');
        sb.append(String.format(Locale.ROOT, "PnL: %s (%+.2f%%)\n", usd(p.getRealizedPnlUsd()), p.getRealizedPnlPct()));
        sb.append(String.format(Locale.ROOT, "MFE %+.2f%% | MAE %+.2f%% | held %s",
            p.mfePct(), p.maePct(), duration(p.holdingTime(p.getClosedAt()))));
        return sb.toString();
    }

    /**
     * Message for a non-closing lifecycle update.
     */
    public static String updated(LifecycleUpdate update) {
        Position p = update.position();
        String head = "<b>" + p.getSide() + " " + escape(p.getSymbol()) + "</b> ";
        switch (update.type()) {
            case STOP_MOVED:
                return "🔒 " + head + "stop moved to " + price(update.price());
            case DCA_STEP: {
                DcaState dca = p.getDca();
                StringBuilder sb = new StringBuilder("➕ ").append(head)
                    .append("step ").append(dca.getStepsFilled()).append('/').append(dca.getLevels())
                    .append(" at ").append(price(update.price())).append('\n');
                sb.append("Avg: ").append(price(dca.getAvgPrice()))
                    .append(" | TP: ").append(price(p.getTakeProfit())).append('\n');
                sb.append("Margin: ").append(usd(dca.cumulativeMargin()))
                    .append(" | Liq ≈ ").append(price(dca.getLiquidationPrice()));
                return sb.toString();
            }
            case FROZEN:
                return "⚠️ " + head + "range breakout at " + price(update.price()) + ", ladder frozen";
            case CLOSED:
                return closed(p);
            default:
                throw new IllegalArgumentException("Unknown update: " + update.type());
        }
    }

    static String usd(double value) {
        return String.format(Locale.ROOT, "%.2f USDT", value);
    }

    static String duration(Duration d) {
        long minutes = d.toMinutes();
        if (minutes < 60) {
            return minutes + "m";
        }
        return (minutes / 60) + "h" + String.format(Locale.ROOT, "%02d", minutes % 60) + "m";
    }

    static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String arrow(Side side) {
        return side == Side.LONG ? "🟢" : "🔴";
    }
}
