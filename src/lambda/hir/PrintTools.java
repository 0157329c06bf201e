package lambda.hir;

import lambda.exec.Config;

import java.io.PrintStream;
import java.util.Collection;
import java.util.Iterator;

/**
* Status output helpers shared by the framework. Every message carries a
* verbosity level and is printed to stderr only if the configured verbosity
* ({@code verbosity} in {@code lambda.cfg}) is at least that level.
*/
public final class PrintTools {

    /** Platform line separator. */
    public static final String line_sep = System.getProperty("line.separator");

    private static PrintStream err = System.err;

    private PrintTools() {
    }

    /**
    * Returns the configured verbosity level.
    *
    * @return the verbosity, zero if unset.
    */
    public static int getVerbosity() {
        return Config.getConfig().getVerbosity();
    }

    /**
    * Redirects status output. Intended for tests capturing the log.
    *
    * @param stream the new destination.
    * @return the previous destination.
    */
    public static synchronized PrintStream setStream(PrintStream stream) {
        PrintStream old = err;
        err = stream;
        return old;
    }

    /**
    * Prints a message followed by a newline if the verbosity permits it.
    *
    * @param s the message.
    * @param min_verbosity the lowest verbosity at which the message appears.
    */
    public static void println(String s, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            err.println(s);
        }
    }

    /**
    * Prints a status message, same as {@link #println(String, int)}.
    */
    public static void printlnStatus(String s, int min_verbosity) {
        println(s, min_verbosity);
    }

    /**
    * Prints the space-separated string forms of {@code msg} as one status
    * line if the verbosity permits it. The objects are not converted to
    * strings otherwise.
    *
    * @param min_verbosity the lowest verbosity at which the message appears.
    * @param msg the message parts.
    */
    public static void printlnStatus(int min_verbosity, Object... msg) {
        if (getVerbosity() >= min_verbosity) {
            err.println(concat(msg));
        }
    }

    /**
    * Same as {@link #printlnStatus(int, Object...)} without the newline.
    */
    public static void printStatus(int min_verbosity, Object... msg) {
        if (getVerbosity() >= min_verbosity) {
            err.print(concat(msg));
        }
    }

    /**
    * Converts a collection to a string, joining the elements with the
    * separator.
    */
    public static String collectionToString(Collection<?> coll, String sep) {
        if (coll == null || coll.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(80);
        Iterator<?> iter = coll.iterator();
        sb.append(iter.next());
        while (iter.hasNext()) {
            sb.append(sep).append(iter.next());
        }
        return sb.toString();
    }

    private static String concat(Object[] msg) {
        StringBuilder sb = new StringBuilder(80);
        for (int i = 0; i < msg.length; i++) {
            if (i > 0) {
                sb.append(" ");
            }
            sb.append(msg[i]);
        }
        return sb.toString();
    }
}
