package slate.rewrite;

import com.google.common.base.Preconditions;

/**
 * Bounds on the work the engine does for one expression.
 *
 * @param minPasses       passes always allowed, however small the expression
 * @param passesPerNode   passes allowed per node of the input expression
 * @param maxExponent     largest integer exponent folded exactly
 * @param maxResultBits   largest numerator or denominator, in bits, a folded power may produce
 */
public record EngineLimits(int minPasses, int passesPerNode, int maxExponent, int maxResultBits) {

    public static final EngineLimits DEFAULT = new EngineLimits(16, 4, 4096, 65536);

    public EngineLimits {
        Preconditions.checkArgument(minPasses > 0, "minPasses must be positive: %s", minPasses);
        Preconditions.checkArgument(passesPerNode > 0, "passesPerNode must be positive: %s", passesPerNode);
        Preconditions.checkArgument(maxExponent > 0, "maxExponent must be positive: %s", maxExponent);
        Preconditions.checkArgument(maxResultBits > 0, "maxResultBits must be positive: %s", maxResultBits);
    }

    public int passLimit(int nodeCount) {
        return Math.max(minPasses, passesPerNode * nodeCount);
    }
}
