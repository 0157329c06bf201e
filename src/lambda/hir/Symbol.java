package lambda.hir;

/**
* Interned name. Two symbols with the same spelling obtained from the same
* {@link SymbolTable} are the same object, so symbols compare by identity.
*/
public final class Symbol {

    private final String spelling;

    Symbol(String spelling) {
        this.spelling = spelling;
    }

    /**
    * Returns the text of the name.
    */
    public String getSpelling() {
        return spelling;
    }

    @Override
    public String toString() {
        return spelling;
    }
}
