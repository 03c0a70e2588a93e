package com.chaintruth.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NetworkFamilyTest {

    @Test
    void evm_comparesIgnoringCase() {
        assertThat(NetworkFamily.EVM.sameAddress(
                "0x742d35Cc6634C0532925a3b844Bc454e4438f44e", "0x742d35cc6634c0532925a3b844bc454e4438f44e")).isTrue();
    }

    @Test
    void utxo_bech32IgnoresCase_base58IsExact() {
        assertThat(NetworkFamily.UTXO.sameAddress(
                "bc1qar0srrr7xfkvy5l643lydnw9re59gtzzwf5mdq", "BC1QAR0SRRR7XFKVY5L643LYDNW9RE59GTZZWF5MDQ")).isTrue();
        assertThat(NetworkFamily.UTXO.sameAddress(
                "1BvBMSEYstWetqTFn5Au4m4GFg7xJaNVN2", "1bvbmseystwetqtfn5au4m4gfg7xjanvn2")).isFalse();
    }

    @Test
    void sol_isExact() {
        assertThat(NetworkFamily.SOL.sameAddress(
                "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM", "9wzdxwbbmkg8ztbnmquxvqrayrzzdsgydlvl9zytawwm")).isFalse();
        assertThat(NetworkFamily.SOL.sameAddress(null, "x")).isFalse();
    }

    @Test
    void canonicalAddress_lowercasesOnlyCaseInsensitiveEncodings() {
        assertThat(NetworkFamily.EVM.canonicalAddress(" 0xABC ")).isEqualTo("0xabc");
        assertThat(NetworkFamily.UTXO.canonicalAddress("BC1QAR0SRRR7XFKVY5L643LYDNW9RE59GTZZWF5MDQ"))
                .isEqualTo("bc1qar0srrr7xfkvy5l643lydnw9re59gtzzwf5mdq");
        assertThat(NetworkFamily.UTXO.canonicalAddress("1BvBMSEYstWetqTFn5Au4m4GFg7xJaNVN2"))
                .isEqualTo("1BvBMSEYstWetqTFn5Au4m4GFg7xJaNVN2");
    }
}
