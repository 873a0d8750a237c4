package com.localization.toolkit.storage.exception;

/**
 * The source of a single unit is not valid Fluent.
 * Line and column point into the unit source, not into the file.
 */
public class FluentSourceSyntaxException extends FluentException {

	private static final long serialVersionUID = 1L;
	private final String unitId;
	private final String code;
	private final int line;
	private final int column;

    public FluentSourceSyntaxException(String unitId, String code, String detail, int line, int column) {
        super("Error in source of FluentUnit \"" + unitId + "\":\n"
                + code + ": " + detail + " [line " + line + ", column " + column + "]");
        this.unitId = unitId;
        this.code = code;
        this.line = line;
        this.column = column;
    }

    public String getUnitId() {
        return unitId;
    }

    public String getCode() {
        return code;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
