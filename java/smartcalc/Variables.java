package smartcalc;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Variables of one calculator session. Values are always plain decimal numbers,
 * never references to other variables.
 */
public class Variables implements Expr.Context {
    private final Map<String, String> values = new HashMap<>();

    @Override
    public String lookupVariable(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * @param name letters only
     * @param value integer constant, optionally signed; stored in canonical form
     */
    public void assign(String name, String value) {
        if (!Expr.isName(name)) throw new IllegalArgumentException("not an identifier: " + name);
        values.put(name, new BigInteger(value).toString());
    }

    public List<String> names() {
        return values.keySet().stream().sorted().collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return names().stream()
                .map(n -> n + " = " + values.get(n))
                .collect(Collectors.joining("\n"));
    }
}
