package io.catena.core.exception;

import java.io.Serial;

/// Thrown when nested chain invocations exceed the configured depth.
///
/// Terminal: the whole execution fails immediately.
public class MaxRecursionDepthExceededException extends CatenaException {

    @Serial private static final long serialVersionUID = -5605126750936681120L;

    public MaxRecursionDepthExceededException(String chainId, int depth, int maxDepth) {
        super(
                "Chain '"
                        + chainId
                        + "' would run at depth "
                        + depth
                        + ", exceeding the limit of "
                        + maxDepth);
    }

    @Override
    public String errorType() {
        return "max_recursion_depth";
    }
}
