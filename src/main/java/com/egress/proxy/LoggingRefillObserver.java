package com.egress.proxy;

import lombok.extern.slf4j.Slf4j;

/**
 * Logs refill progress as a small text bar, e.g. {@code [----->··········] 7/20 (35%)}.
 */
@Slf4j
public class LoggingRefillObserver implements RefillObserver {

    private static final int BAR_LENGTH = 15;

    @Override
    public void onAttempt(RefillProgress progress) {
        log.info("Refill attempt {}/{} {} (fetched {}, probed {}, added {})",
                progress.attempt(), progress.maxAttempts(),
                bar(progress.poolSize(), progress.targetSize()),
                progress.fetched(), progress.probed(), progress.inserted());
    }

    static String bar(int current, int total) {
        int shown = Math.min(current, total);
        int percent = total > 0 ? (int) Math.floor(shown * 100.0 / total) : 0;
        int filled = BAR_LENGTH * percent / 100;
        String bar = percent >= 100
                ? "[" + "-".repeat(BAR_LENGTH) + ">]"
                : "[" + "-".repeat(filled) + ">" + "·".repeat(BAR_LENGTH - filled) + "]";
        return String.format("%s %d/%d (%d%%)", bar, shown, total, percent);
    }
}
