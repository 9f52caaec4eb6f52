package com.mrgris.resample;

import java.util.Objects;

/*
 * row/column cursor into a grid. may carry a computed value, but identity (equals/hashCode)
 * is the position only, so a cell with a value still matches its bare counterpart in a set
 */
public class Cell {

	public final int row;
	public final int col;
	public final float value;

	public Cell(int row, int col) {
		this(row, col, Float.NaN);
	}

	public Cell(int row, int col, float value) {
		this.row = row;
		this.col = col;
		this.value = value;
	}

	public boolean hasValue() {
		return !Float.isNaN(value);
	}

	public boolean equals(Object o) {
		if (o instanceof Cell) {
			Cell c = (Cell)o;
			return this.row == c.row && this.col == c.col;
		} else {
			return false;
		}
	}

	public int hashCode() {
		return Objects.hash(row, col);
	}

	public String toString() {
		return "(" + row + "," + col + (hasValue() ? ":" + value : "") + ")";
	}
}
