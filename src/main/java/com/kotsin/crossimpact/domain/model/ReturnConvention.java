package com.kotsin.crossimpact.domain.model;

/**
 * How a forward mid-price change is expressed. One convention is applied to a whole run.
 */
public enum ReturnConvention {
    /** mid(t+h) - mid(t) */
    PRICE_DIFFERENCE,
    /** ln(mid(t+h) / mid(t)) */
    LOG_RETURN;

    public double apply(double midAtStart, double midAtEnd) {
        if (this == LOG_RETURN) {
            return Math.log(midAtEnd / midAtStart);
        }
        return midAtEnd - midAtStart;
    }
}
