package lambda.hir;

import java.util.HashMap;
import java.util.Map;

/**
* Interns names so that each distinct spelling maps to exactly one
* {@link Symbol}. Not thread-safe.
*/
public class SymbolTable {

    private final Map<String, Symbol> symbols;

    public SymbolTable() {
        symbols = new HashMap<String, Symbol>();
    }

    /**
    * Returns the symbol for the given spelling, creating it on first use.
    *
    * @param spelling the name text.
    * @return the unique symbol for {@code spelling}.
    * @throws IllegalArgumentException if {@code spelling} is null or empty.
    */
    public Symbol intern(String spelling) {
        if (spelling == null || spelling.isEmpty()) {
            throw new IllegalArgumentException("empty symbol name");
        }
        Symbol sym = symbols.get(spelling);
        if (sym == null) {
            sym = new Symbol(spelling);
            symbols.put(spelling, sym);
        }
        return sym;
    }

    /**
    * Returns the symbol already interned for the spelling, or null.
    */
    public Symbol lookup(String spelling) {
        return symbols.get(spelling);
    }

    public int size() {
        return symbols.size();
    }
}
