package io.catena.core.exception;

import java.io.Serial;

/// Thrown when a chain id does not resolve to a registered chain definition.
public class ChainNotFoundException extends CatenaException {

    @Serial private static final long serialVersionUID = 2876033150784452913L;

    private final String chainId;

    public ChainNotFoundException(String chainId) {
        super("Chain not found: " + chainId);
        this.chainId = chainId;
    }

    public String getChainId() {
        return chainId;
    }

    @Override
    public String errorType() {
        return "chain_not_found";
    }
}
