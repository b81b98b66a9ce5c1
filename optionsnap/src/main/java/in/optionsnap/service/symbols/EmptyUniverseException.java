package in.optionsnap.service.symbols;

/**
 * Thrown when a symbol refresh downloads a feed that yields no usable symbols.
 */
public class EmptyUniverseException extends RuntimeException {

    private final int linesRead;

    public EmptyUniverseException(int linesRead) {
        super("OCC feed yielded no symbols (" + linesRead + " lines read)");
        this.linesRead = linesRead;
    }

    public int getLinesRead() {
        return linesRead;
    }
}
