package com.chaintruth.chain.facts;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Family-independent view of a transaction: who sent it, where it sits in the chain,
 * whether it succeeded and what each recipient received.
 *
 * @param blockHeight null while pending
 */
public record NormalizedChainTx(
        String txHash,
        String sender,
        Long blockHeight,
        boolean succeeded,
        List<ObservedTransfer> transfers
) {

    public NormalizedChainTx {
        transfers = transfers != null ? List.copyOf(transfers) : List.of();
    }

    public boolean isPending() {
        return blockHeight == null;
    }

    /**
     * Transfers to {@code address}, compared with the family's address rules.
     */
    public List<ObservedTransfer> transfersTo(String address, BiPredicate<String, String> sameAddress) {
        return transfers.stream()
                .filter(t -> sameAddress.test(t.recipient(), address))
                .toList();
    }

    /**
     * Total received by one recipient in one asset.
     */
    public static BigInteger sum(List<ObservedTransfer> transfers) {
        return transfers.stream()
                .map(ObservedTransfer::amount)
                .filter(Objects::nonNull)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }
}
