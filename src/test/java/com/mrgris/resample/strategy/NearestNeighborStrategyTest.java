package com.mrgris.resample.strategy;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import com.mrgris.resample.ConflictMethod;
import com.mrgris.resample.grid.Grid;

public class NearestNeighborStrategyTest {

	static final float ND = -9999f;

	static Grid zones(int rows, int cols, float zoneValue) {
		float[][] v = new float[rows][cols];
		for (float[] row : v) {
			Arrays.fill(row, zoneValue);
		}
		return Grid.of(v, 1, ND);
	}

	static Grid resample(float[][] values, ConflictMethod method, boolean diagonal) {
		Grid valueGrid = Grid.of(values, 1, ND);
		Grid zoneGrid = zones(valueGrid.rows, valueGrid.cols, 1f);
		return new NearestNeighborStrategy(method, diagonal).resample(valueGrid, zoneGrid, 1f);
	}

	@Test
	public void testCenterFromEightNeighbors() {
		Grid result = resample(new float[][] {{1, 2, 3}, {4, ND, 5}, {6, 7, 8}}, ConflictMethod.ARITHMETIC_AVERAGE, true);
		assertEquals(4.5f, result.get(1, 1), 0f);
		assertEquals(1f, result.get(0, 0), 0f);
		assertEquals(8f, result.get(2, 2), 0f);
	}

	@Test
	public void testCenterFromFourNeighbors() {
		Grid result = resample(new float[][] {{1, 2, 3}, {4, ND, 5}, {6, 7, 8}}, ConflictMethod.ARITHMETIC_AVERAGE, false);
		assertEquals(4.5f, result.get(1, 1), 0f);

		result = resample(new float[][] {{100, 2, 100}, {4, ND, 6}, {100, 8, 100}}, ConflictMethod.ARITHMETIC_AVERAGE, false);
		assertEquals(5f, result.get(1, 1), 0f);
	}

	@Test
	public void testCellsOfOneRoundDoNotSeeEachOther() {
		// both empty cells are resolved in the first round; the right one must not average in its left neighbor
		Grid result = resample(new float[][] {{ND, ND}, {10, 20}}, ConflictMethod.ARITHMETIC_AVERAGE, false);
		assertEquals(10f, result.get(0, 0), 0f);
		assertEquals(20f, result.get(0, 1), 0f);
	}

	@Test
	public void testPropagatesOverSeveralRounds() {
		Grid result = resample(new float[][] {{10, ND, 30}, {ND, ND, ND}}, ConflictMethod.ARITHMETIC_AVERAGE, false);
		// round 1
		assertEquals(20f, result.get(0, 1), 0f);
		assertEquals(10f, result.get(1, 0), 0f);
		assertEquals(30f, result.get(1, 2), 0f);
		// round 2: right, up and left neighbors from round 1
		assertEquals(20f, result.get(1, 1), 0f);

		result = resample(new float[][] {{7, ND, ND, ND, ND}}, ConflictMethod.ARITHMETIC_AVERAGE, true);
		assertArrayEquals(new float[] {7, 7, 7, 7, 7}, result.values[0], 0f);
	}

	@Test
	public void testHarmonicAverage() {
		Grid result = resample(new float[][] {{2, ND, 6}}, ConflictMethod.HARMONIC_AVERAGE, true);
		assertEquals(3f, result.get(0, 1), 1e-6f);
	}

	@Test
	public void testHarmonicAverageWithZeroNeighborIsZero() {
		Grid result = resample(new float[][] {{0, 2, 3}, {4, ND, 5}, {6, 7, 8}}, ConflictMethod.HARMONIC_AVERAGE, true);
		assertEquals(0f, result.get(1, 1), 0f);
	}

	@Test
	public void testMinimumAndMaximum() {
		float[][] v = {{2, ND, 6}, {ND, -3, ND}};
		Grid min = resample(v, ConflictMethod.MINIMUM_VALUE, false);
		assertEquals(-3f, min.get(0, 1), 0f);
		assertEquals(-3f, min.get(1, 0), 0f);

		Grid max = resample(v, ConflictMethod.MAXIMUM_VALUE, false);
		assertEquals(6f, max.get(0, 1), 0f);
		assertEquals(2f, max.get(1, 0), 0f);
		assertEquals(6f, max.get(1, 2), 0f);
	}

	@Test
	public void testOnlyZoneCellsAreResampled() {
		Grid valueGrid = Grid.of(new float[][] {{10, ND, ND, 40}}, 1, ND);
		Grid zoneGrid = Grid.of(new float[][] {{1, 1, 2, 2}}, 1, ND);

		Grid result = new NearestNeighborStrategy(ConflictMethod.ARITHMETIC_AVERAGE, true).resample(valueGrid, zoneGrid, 1f);

		assertArrayEquals(new float[] {10, 10, ND, ND}, result.values[0], 0f);
		// input is left alone
		assertEquals(ND, valueGrid.get(0, 1), 0f);
	}

	@Test
	public void testUnreachableCellsStayEmpty() {
		Grid valueGrid = Grid.of(new float[][] {{ND, ND}}, 1, ND);
		Grid result = new NearestNeighborStrategy(ConflictMethod.ARITHMETIC_AVERAGE, true).resample(valueGrid, zones(1, 2, 1f), 1f);
		assertEquals(0, result.countNonNoData());
	}
}
