package work.lcod.formula.runtime;

/**
 * Value of a reference that resolves to nothing, mirroring a blank spreadsheet cell.
 */
public enum Blank {
    INSTANCE;

    @Override
    public String toString() {
        return "";
    }
}
