package com.streamfirst.ddns.domain;

/**
 * Receipt of a fast-ledger batch write that reached the requested confirmation depth.
 *
 * @param transactionId identifier of the write on the fast ledger
 * @param height fast ledger height the write was included at
 * @param confirmations confirmations observed when the receipt was issued
 */
public record WriteConfirmation(String transactionId, long height, int confirmations) {}
