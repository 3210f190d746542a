package io.vtascan.types;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A function signature. The receiver of a method is not part of its signature.
 *
 * @param params   Parameter types; for variadic signatures the last one is a slice type
 * @param results  Result types
 * @param variadic Whether the last parameter is variadic
 */
public record Signature(List<Type> params, List<Type> results, boolean variadic) implements Type {

    public static final Signature NO_ARGS = new Signature(List.of(), List.of(), false);

    public Signature {
        params = List.copyOf(params);
        results = List.copyOf(results);
        if (variadic && (params.isEmpty() || !(params.get(params.size() - 1) instanceof SliceType))) {
            throw new IllegalArgumentException("Variadic signature must end with a slice parameter");
        }
    }

    public Signature(List<Type> params, List<Type> results) {
        this(params, results, false);
    }

    /**
     * Returns the type of a call to a function with this signature: the single result type,
     * or a tuple for zero or several results.
     */
    public Type resultType() {
        if (results.size() == 1) {
            return results.get(0);
        }
        return new TupleType(results);
    }

    @Override
    public String toString() {
        List<String> rendered = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            Type p = params.get(i);
            if (variadic && i == params.size() - 1) {
                rendered.add("..." + ((SliceType) p).elem());
            } else {
                rendered.add(p.toString());
            }
        }
        String sig = "func(" + String.join(", ", rendered) + ")";
        if (results.isEmpty()) {
            return sig;
        }
        if (results.size() == 1) {
            return sig + " " + results.get(0);
        }
        return sig + results.stream()
                .map(Type::toString)
                .collect(Collectors.joining(", ", " (", ")"));
    }
}
