package com.mrgris.resample;

import static org.junit.Assert.*;

import java.util.Properties;

import org.junit.Test;

import com.mrgris.resample.grid.Extent;
import com.mrgris.resample.grid.Grid;

public class ZoneResamplerTest {

	static final float ND = -9999f;

	static ResampleSettings settings(String... keyValues) {
		Properties props = ResampleSettings.defaults();
		for (int i = 0; i < keyValues.length; i += 2) {
			props.setProperty(keyValues[i], keyValues[i + 1]);
		}
		return ResampleSettings.fromProperties(props);
	}

	@Test
	public void testNearestNeighborEndToEnd() {
		Grid zoneGrid = Grid.of(new float[][] {{1, 1, 1}, {1, 1, 1}, {1, 1, 1}}, 1, 0f);
		Grid valueGrid = Grid.of(new float[][] {{1, 2, 3}, {4, ND, 5}, {6, 7, 8}}, 1, ND);

		Grid result = new ZoneResampler(settings()).resample(valueGrid, zoneGrid);

		assertEquals(4.5f, result.get(1, 1), 0f);
		assertEquals(ND, result.noData, 0f);
		assertEquals(zoneGrid.extent, result.extent);
	}

	@Test
	public void testRegionsDoNotBleed() {
		Grid zoneGrid = Grid.of(new float[][] {{1, 1, 0, 1, 1}}, 1, 0f);
		Grid valueGrid = Grid.of(new float[][] {{10, ND, ND, ND, 30}}, 1, ND);

		Grid result = new ZoneResampler(settings()).resample(valueGrid, zoneGrid);

		assertArrayEquals(new float[] {10, 10, ND, 30, 30}, result.values[0], 0f);
	}

	@Test
	public void testZonesDoNotBleed() {
		Grid zoneGrid = Grid.of(new float[][] {{1, 1, 2, 2}}, 1, 0f);
		Grid valueGrid = Grid.of(new float[][] {{10, ND, ND, 40}}, 1, ND);

		Grid result = new ZoneResampler(settings("resampleMethod", "idw")).resample(valueGrid, zoneGrid);

		assertArrayEquals(new float[] {10, 10, 40, 40}, result.values[0], 0f);
	}

	@Test
	public void testIDW() {
		Grid zoneGrid = Grid.of(new float[][] {{1, 1, 1}}, 1, 0f);
		Grid valueGrid = Grid.of(new float[][] {{10, ND, 30}}, 1, ND);

		Grid result = new ZoneResampler(settings("resampleMethod", "idw")).resample(valueGrid, zoneGrid);

		assertEquals(20f, result.get(0, 1), 1e-5f);
	}

	@Test
	public void testZoneValueEqualToValueNoData() {
		Grid zoneGrid = Grid.of(new float[][] {{ND, ND, ND}}, 1, 0f);
		Grid valueGrid = Grid.of(new float[][] {{10, ND, 30}}, 1, ND);

		Grid result = new ZoneResampler(settings()).resample(valueGrid, zoneGrid);

		assertArrayEquals(new float[] {10, 20, 30}, result.values[0], 0f);
	}

	@Test
	public void testStatistics() {
		Grid zoneGrid = Grid.of(new float[][] {{1, 1}, {1, 2}}, 1, 0f);
		Grid valueGrid = Grid.of(new float[][] {{10, 20}, {30, ND}}, 1, ND);

		Grid mean = new ZoneResampler(settings("resampleMethod", "mean")).resample(valueGrid, zoneGrid);
		assertArrayEquals(new float[] {20, 20}, mean.values[0], 0f);
		assertArrayEquals(new float[] {20, ND}, mean.values[1], 0f);

		Grid perc = new ZoneResampler(settings("resampleMethod", "perc", "percentile", "100")).resample(valueGrid, zoneGrid);
		assertArrayEquals(new float[] {30, 30}, perc.values[0], 0f);

		Grid local = new ZoneResampler(settings("resampleMethod", "min", "statDistance", "1")).resample(valueGrid, zoneGrid);
		assertArrayEquals(new float[] {10, 10}, local.values[0], 0f);
	}

	@Test
	public void testValueGridIsAlignedToZoneExtent() {
		// value grid is one cell larger on the left and misses the top row of the zone
		Grid valueGrid = new Grid(new float[][] {{99, 1, ND}, {99, 4, 5}}, new Extent(-1, 0, 2, 2), 1, ND);
		Grid zoneGrid = new Grid(new float[][] {{1, 1}, {1, 1}, {1, 1}}, new Extent(0, 0, 2, 3), 1, 0f);

		Grid aligned = ZoneResampler.alignToZone(valueGrid, zoneGrid);
		assertEquals(zoneGrid.extent, aligned.extent);
		assertArrayEquals(new float[] {ND, ND}, aligned.values[0], 0f);
		assertArrayEquals(new float[] {1, ND}, aligned.values[1], 0f);
		assertArrayEquals(new float[] {4, 5}, aligned.values[2], 0f);

		Grid result = new ZoneResampler(settings("resampleMethod", "max")).resample(valueGrid, zoneGrid);
		assertEquals(3, result.rows);
		assertEquals(2, result.cols);
		assertEquals(5f, result.get(0, 0), 0f);
	}

	@Test(expected = ResampleException.class)
	public void testNoOverlap() {
		Grid valueGrid = new Grid(new Extent(10, 10, 12, 12), 1, ND);
		Grid zoneGrid = new Grid(new Extent(0, 0, 2, 2), 1, 0f);
		new ZoneResampler(settings()).resample(valueGrid, zoneGrid);
	}

	@Test(expected = ResampleException.class)
	public void testCellSizeMismatch() {
		Grid valueGrid = new Grid(new Extent(0, 0, 4, 4), 2, ND);
		Grid zoneGrid = new Grid(new Extent(0, 0, 4, 4), 1, 0f);
		new ZoneResampler(settings()).resample(valueGrid, zoneGrid);
	}

	@Test
	public void testDerivedZoneForNearestNeighbor() {
		float[][] v = new float[5][5];
		v[2][2] = ND;
		Grid valueGrid = Grid.of(v, 1, ND);

		// grown without diagonals by default
		Grid zone = new ZoneResampler(settings()).deriveZone(valueGrid);
		assertEquals(5, zone.countNonNoData());
		assertFalse(zone.hasValue(1, 1));
		assertEquals(ZoneResampler.DERIVED_ZONE, zone.get(1, 2), 0f);

		zone = new ZoneResampler(settings("skipDiagonalProcessing", "true")).deriveZone(valueGrid);
		assertEquals(9, zone.countNonNoData());
		assertEquals(ZoneResampler.DERIVED_ZONE, zone.get(1, 1), 0f);
	}

	@Test
	public void testResampleInDerivedZone() {
		Grid valueGrid = Grid.of(new float[][] {{1, 2, 3}, {4, ND, 5}, {6, 7, 100}}, 1, ND);
		ZoneResampler resampler = new ZoneResampler(settings());

		Grid zone = resampler.deriveZone(valueGrid);
		Grid result = resampler.resample(valueGrid, zone);

		assertEquals(5, zone.countNonNoData());
		// corners lie outside the derived zone
		assertEquals(4.5f, result.get(1, 1), 0f);
		assertEquals(5, result.countNonNoData());
	}

	@Test
	public void testDerivedZoneForStatistics() {
		Grid valueGrid = Grid.of(new float[][] {{3, ND, 5}}, 1, ND);
		Grid zone = new ZoneResampler(settings("resampleMethod", "mean")).deriveZone(valueGrid);
		assertTrue(zone.hasValue(0, 0));
		assertFalse(zone.hasValue(0, 1));
		assertTrue(zone.hasValue(0, 2));
	}
}
