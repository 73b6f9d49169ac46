package com.walletwatch.lookup;

import java.util.List;

/**
 * NFT holdings grouped by standard, each group sorted by token count descending.
 */
public record NftHoldings(String address, List<NftHolding> kip17, List<NftHolding> kip37) {

    public boolean isEmpty() {
        return kip17.isEmpty() && kip37.isEmpty();
    }
}
