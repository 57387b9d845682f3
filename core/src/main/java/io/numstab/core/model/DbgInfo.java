package io.numstab.core.model;

/**
 * Free-form provenance describing where in the host program an expression came
 * from. Stored append-only next to the cached result it refers to; any field
 * may be {@code null}.
 *
 * @param comments     free text
 * @param moduleName   host module containing the expression
 * @param functionName host function containing the expression
 * @param functionType declared type of that function
 */
public record DbgInfo(String comments, String moduleName, String functionName, String functionType) {

    public static DbgInfo of(String moduleName, String functionName) {
        return new DbgInfo(null, moduleName, functionName, null);
    }
}
