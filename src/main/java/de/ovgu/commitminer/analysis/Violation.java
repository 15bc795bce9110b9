package de.ovgu.commitminer.analysis;

/**
 * One rule violation reported by the analyzer.
 */
public final class Violation {
    private final String file;
    private final String rule;
    private final String description;
    private final int beginLine;

    /**
     * @param file Path of the file relative to the analyzed tree
     */
    public Violation(String file, String rule, String description, int beginLine) {
        this.file = file;
        this.rule = rule;
        this.description = description;
        this.beginLine = beginLine;
    }

    public String getFile() {
        return file;
    }

    public String getRule() {
        return rule;
    }

    public String getDescription() {
        return description;
    }

    public int getBeginLine() {
        return beginLine;
    }

    @Override
    public String toString() {
        return file + ":" + beginLine + ": " + rule;
    }
}
