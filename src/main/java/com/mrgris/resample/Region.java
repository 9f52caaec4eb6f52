package com.mrgris.resample;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.mrgris.resample.grid.Grid;

/* one connected component found by RegionFinder, clipped to its bounding box */
public class Region {

	public final Grid grid;
	public final List<Cell> cells;

	// bounding box, in row/column indices of the grid that was searched
	public final int minRow;
	public final int minCol;
	public final int maxRow;
	public final int maxCol;

	public Region(Grid grid, List<Cell> cells, int minRow, int minCol, int maxRow, int maxCol) {
		this.grid = grid;
		this.cells = ImmutableList.copyOf(cells);
		this.minRow = minRow;
		this.minCol = minCol;
		this.maxRow = maxRow;
		this.maxCol = maxCol;
	}

	public int size() {
		return cells.size();
	}

	public String toString() {
		return String.format("%d cells in [%d,%d]-[%d,%d]", cells.size(), minRow, minCol, maxRow, maxCol);
	}
}
