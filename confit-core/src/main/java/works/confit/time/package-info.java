/**
 * Calendar-aware durations such as {@code 2d} or {@code 1y 6mo}.
 */
package works.confit.time;
