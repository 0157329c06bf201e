package lambda.hir;

/**
* Immutable source position attached to a node. Lines and columns start at 1;
* {@link #UNKNOWN} stands for a node whose position has not been recorded.
*/
public final class Location {

    /** Position of nodes built without source information. */
    public static final Location UNKNOWN = new Location(null, 0, 0);

    private final String file;
    private final int line;
    private final int column;

    private Location(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    /**
    * Returns a known location.
    *
    * @param file the source name, may be null for anonymous input.
    * @param line the line number, at least 1.
    * @param column the column number, at least 1.
    * @throws IllegalArgumentException if line or column is not positive.
    */
    public static Location of(String file, int line, int column) {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException(
                    "invalid position " + line + ":" + column);
        }
        return new Location(file, line, column);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Location)) {
            return false;
        }
        Location other = (Location)o;
        return line == other.line && column == other.column
                && (file == null ? other.file == null : file.equals(other.file));
    }

    @Override
    public int hashCode() {
        int h = (file == null) ? 0 : file.hashCode();
        h = 31 * h + line;
        return 31 * h + column;
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return "<unknown>";
        }
        return ((file == null) ? "" : file + ":") + line + ":" + column;
    }
}
