package com.chaintruth.chain.facts;

import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The one normalization boundary per chain family. Everything downstream works on {@link NormalizedChainTx}.
 */
@Component
public class ChainFactsNormalizer {

    /** keccak256("Transfer(address,address,uint256)") */
    public static final String ERC20_TRANSFER_TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";
    /** transfer(address,uint256) selector */
    public static final String ERC20_TRANSFER_SELECTOR = "0xa9059cbb";

    public NormalizedChainTx normalize(ChainTxFacts facts) {
        Objects.requireNonNull(facts, "facts");
        if (facts instanceof EvmTxFacts evm) {
            return normalizeEvm(evm);
        }
        if (facts instanceof UtxoTxFacts utxo) {
            return normalizeUtxo(utxo);
        }
        if (facts instanceof SolanaTxFacts sol) {
            return normalizeSolana(sol);
        }
        throw new IllegalArgumentException("Unsupported facts: " + facts.getClass());
    }

    NormalizedChainTx normalizeEvm(EvmTxFacts facts) {
        List<ObservedTransfer> transfers = new ArrayList<>();
        if (facts.to() != null && facts.value() != null && facts.value().signum() > 0) {
            transfers.add(new ObservedTransfer(lower(facts.to()), null, facts.value()));
        }
        boolean sawTransferLog = false;
        for (EvmTxFacts.Log log : facts.logs()) {
            List<String> topics = log.topics();
            if (topics.size() != 3 || !ERC20_TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0))) {
                continue;
            }
            sawTransferLog = true;
            transfers.add(new ObservedTransfer(topicAddress(topics.get(2)), lower(log.address()), hexToBigInteger(log.data())));
        }
        // a reverted token call emits no logs; attribute it through its calldata
        if (!sawTransferLog && Boolean.FALSE.equals(facts.receiptStatus())) {
            ObservedTransfer intended = decodeTransferCall(facts.to(), facts.input());
            if (intended != null) {
                transfers.add(intended);
            }
        }
        boolean succeeded = !Boolean.FALSE.equals(facts.receiptStatus());
        return new NormalizedChainTx(facts.txHash(), lower(facts.from()), facts.blockNumber(), succeeded, merge(transfers));
    }

    NormalizedChainTx normalizeUtxo(UtxoTxFacts facts) {
        List<ObservedTransfer> transfers = new ArrayList<>();
        for (UtxoTxFacts.Output output : facts.outputs()) {
            if (output.address() != null && output.value() != null && output.value().signum() > 0) {
                transfers.add(new ObservedTransfer(output.address(), null, output.value()));
            }
        }
        String sender = facts.inputAddresses().isEmpty() ? null : facts.inputAddresses().get(0);
        return new NormalizedChainTx(facts.txHash(), sender, facts.blockHeight(), true, merge(transfers));
    }

    NormalizedChainTx normalizeSolana(SolanaTxFacts facts) {
        List<ObservedTransfer> transfers = new ArrayList<>();
        List<String> keys = facts.accountKeys();
        int n = Math.min(keys.size(), Math.min(facts.preBalances().size(), facts.postBalances().size()));
        for (int i = 0; i < n; i++) {
            BigInteger delta = facts.postBalances().get(i).subtract(facts.preBalances().get(i));
            if (delta.signum() > 0) {
                transfers.add(new ObservedTransfer(keys.get(i), null, delta));
            }
        }
        Map<String, BigInteger> pre = new HashMap<>();
        for (SolanaTxFacts.TokenBalance b : facts.preTokenBalances()) {
            pre.merge(tokenKey(b), b.amount(), BigInteger::add);
        }
        Map<String, SolanaTxFacts.TokenBalance> owners = new LinkedHashMap<>();
        Map<String, BigInteger> post = new LinkedHashMap<>();
        for (SolanaTxFacts.TokenBalance b : facts.postTokenBalances()) {
            post.merge(tokenKey(b), b.amount(), BigInteger::add);
            owners.putIfAbsent(tokenKey(b), b);
        }
        for (Map.Entry<String, BigInteger> e : post.entrySet()) {
            BigInteger delta = e.getValue().subtract(pre.getOrDefault(e.getKey(), BigInteger.ZERO));
            SolanaTxFacts.TokenBalance b = owners.get(e.getKey());
            if (delta.signum() > 0 && b.owner() != null) {
                transfers.add(new ObservedTransfer(b.owner(), b.mint(), delta));
            }
        }
        String feePayer = keys.isEmpty() ? null : keys.get(0);
        return new NormalizedChainTx(facts.txHash(), feePayer, facts.slot(), !facts.failed(), merge(transfers));
    }

    /** transfer(address,uint256) calldata → intended transfer, or null when the input is something else. */
    static ObservedTransfer decodeTransferCall(String contract, String input) {
        if (contract == null || input == null) {
            return null;
        }
        String data = input.toLowerCase(Locale.ROOT);
        if (!data.startsWith(ERC20_TRANSFER_SELECTOR) || data.length() < 10 + 128) {
            return null;
        }
        String recipientWord = data.substring(10, 74);
        String amountWord = data.substring(74, 138);
        return new ObservedTransfer("0x" + recipientWord.substring(24), lower(contract), new BigInteger(amountWord, 16));
    }

    private static String tokenKey(SolanaTxFacts.TokenBalance b) {
        return b.owner() + "|" + b.mint();
    }

    /** Sums repeated (recipient, asset) pairs so a split payment is matched on its total. */
    private static List<ObservedTransfer> merge(List<ObservedTransfer> transfers) {
        Map<String, ObservedTransfer> merged = new LinkedHashMap<>();
        for (ObservedTransfer t : transfers) {
            String key = t.recipient() + "|" + t.assetRef();
            merged.merge(key, t, (a, b) -> new ObservedTransfer(a.recipient(), a.assetRef(), a.amount().add(b.amount())));
        }
        return new ArrayList<>(merged.values());
    }

    private static String topicAddress(String topic) {
        String hex = topic.startsWith("0x") ? topic.substring(2) : topic;
        return "0x" + hex.substring(Math.max(0, hex.length() - 40)).toLowerCase(Locale.ROOT);
    }

    static BigInteger hexToBigInteger(String hex) {
        if (hex == null) {
            return BigInteger.ZERO;
        }
        String h = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return h.isEmpty() ? BigInteger.ZERO : new BigInteger(h, 16);
    }

    private static String lower(String s) {
        return s != null ? s.toLowerCase(Locale.ROOT) : null;
    }
}
