package com.escrowswap.settlement;

/**
 * Tally of one settlement pass.
 *
 * @param waiting  source leg not yet broadcast or not yet confirmed
 * @param deferred retried on the next pass (chain unavailable, escrow short of funds or gas, payout error)
 */
public record SettlementReport(int completed, int failed, int waiting, int deferred) {

    public static final SettlementReport EMPTY = new SettlementReport(0, 0, 0, 0);
}
