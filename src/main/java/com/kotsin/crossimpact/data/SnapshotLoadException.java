package com.kotsin.crossimpact.data;

/**
 * Raised when a symbol's snapshot data cannot be read or parsed.
 */
public class SnapshotLoadException extends RuntimeException {

    private final String symbol;

    public SnapshotLoadException(String symbol, String message) {
        super(symbol + ": " + message);
        this.symbol = symbol;
    }

    public SnapshotLoadException(String symbol, String message, Throwable cause) {
        super(symbol + ": " + message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
