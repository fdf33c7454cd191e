package com.quantinfo.collector.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure calculation utilities for technical indicator series.
 * Input closes are expected oldest-first. Every method returns a list aligned with the input,
 * holding {@code null} at indices where the indicator is not yet defined.
 */
public final class TechnicalIndicators {

    public static final int RSI_PERIOD = 14;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;

    private TechnicalIndicators() {
    }

    // ── Simple Moving Average ────────────────────────────────────────────────

    /**
     * @param closes closing prices, oldest-first
     * @param period number of trailing closes averaged
     * @return series with the SMA from index {@code period - 1} onwards
     */
    public static List<Double> movingAverage(List<Double> closes, int period) {
        requirePositive(period);
        List<Double> out = nulls(closes.size());
        double sum = 0;
        for (int i = 0; i < closes.size(); i++) {
            sum += closes.get(i);
            if (i >= period) {
                sum -= closes.get(i - period);
            }
            if (i >= period - 1) {
                out.set(i, sum / period);
            }
        }
        return out;
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * Computes RSI using Wilder's smoothing. The first value sits at index {@code period},
     * seeded from the simple averages of the first {@code period} deltas; each later index
     * updates the averages with its own delta before computing.
     *
     * @param closes closing prices, oldest-first
     * @param period lookback period (typically 14)
     * @return series of RSI values in [0, 100]
     */
    public static List<Double> rsi(List<Double> closes, int period) {
        requirePositive(period);
        int n = closes.size();
        List<Double> out = nulls(n);
        if (n < period + 1) {
            return out;
        }

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss -= change;
            }
        }
        avgGain /= period;
        avgLoss /= period;
        out.set(period, rsiValue(avgGain, avgLoss));

        for (int i = period + 1; i < n; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
            out.set(i, rsiValue(avgGain, avgLoss));
        }
        return out;
    }

    private static double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── Exponential Moving Average ───────────────────────────────────────────

    /**
     * EMA seeded with the SMA of the first {@code period} closes.
     */
    public static List<Double> ema(List<Double> closes, int period) {
        requirePositive(period);
        int n = closes.size();
        List<Double> out = nulls(n);
        if (n < period) {
            return out;
        }
        double k = 2.0 / (period + 1);
        double ema = 0;
        for (int i = 0; i < period; i++) {
            ema += closes.get(i);
        }
        ema /= period;
        out.set(period - 1, ema);
        for (int i = period; i < n; i++) {
            ema = closes.get(i) * k + ema * (1 - k);
            out.set(i, ema);
        }
        return out;
    }

    // ── MACD ────────────────────────────────────────────────────────────────

    /**
     * MACD line = EMA(fast) - EMA(slow); signal = EMA(signalPeriod) of the MACD line.
     */
    public static Macd macd(List<Double> closes, int fast, int slow, int signalPeriod) {
        int n = closes.size();
        List<Double> fastEma = ema(closes, fast);
        List<Double> slowEma = ema(closes, slow);
        List<Double> line = nulls(n);
        List<Double> defined = new ArrayList<>();
        int first = -1;
        for (int i = 0; i < n; i++) {
            if (fastEma.get(i) != null && slowEma.get(i) != null) {
                double value = fastEma.get(i) - slowEma.get(i);
                line.set(i, value);
                defined.add(value);
                if (first < 0) {
                    first = i;
                }
            }
        }
        List<Double> signal = nulls(n);
        if (first >= 0) {
            List<Double> signalOfDefined = ema(defined, signalPeriod);
            for (int j = 0; j < signalOfDefined.size(); j++) {
                signal.set(first + j, signalOfDefined.get(j));
            }
        }
        return new Macd(line, signal);
    }

    public static Macd macd(List<Double> closes) {
        return macd(closes, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
    }

    private static List<Double> nulls(int size) {
        return new ArrayList<>(Collections.nCopies(size, (Double) null));
    }

    private static void requirePositive(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
    }

    /**
     * MACD line and signal line, both aligned with the input closes.
     */
    public static final class Macd {
        private final List<Double> line;
        private final List<Double> signal;

        Macd(List<Double> line, List<Double> signal) {
            this.line = line;
            this.signal = signal;
        }

        public List<Double> getLine() {
            return line;
        }

        public List<Double> getSignal() {
            return signal;
        }
    }
}
