// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    private static final String HASH = "0x88df016429689c079f3b2f6ad39fa052532c56795b733da78a91ebe6a713944b";

    @Test
    void rpcLines() {
        assertEquals("[RPC] method=eth_chainId duration=1.50ms", LogFormatter.formatRpc("eth_chainId", 1500));
        assertEquals("[RPC-ERROR] method=eth_call code=3 message=execution reverted duration=2.00s",
                LogFormatter.formatRpcError("eth_call", 3, "execution reverted", 2_000_000));
    }

    @Test
    void transactionLines() {
        assertEquals("[TX-SEND] from=0xf39f...2266 to=(create) nonce=5 gasLimit=25200 value=0",
                LogFormatter.formatTxSend("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266", null, 5, 25200, "0"));
        assertEquals("[TX-HASH] hash=0x88df...944b duration=0.93ms", LogFormatter.formatTxHash(HASH, 930));
        assertEquals("[TX-WAIT] hash=0x88df...944b timeout=30.0s", LogFormatter.formatTxWait(HASH, 30_000));
        assertEquals("[TX-WAIT] hash=0x88df...944b timeout=500ms", LogFormatter.formatTxWait(HASH, 500));
        assertEquals("[TX-RECEIPT] hash=0x88df...944b block=12 status=FAILED",
                LogFormatter.formatTxReceipt(HASH, 12, false));
    }

    @Test
    void shortValuesAreNotShortened() {
        assertEquals("0x1234", LogFormatter.shortenHash("0x1234"));
        assertNull(LogFormatter.shortenHash(null));
    }
}
