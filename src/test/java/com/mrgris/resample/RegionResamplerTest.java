package com.mrgris.resample;

import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.mrgris.resample.grid.Grid;
import com.mrgris.resample.grid.GridFormat;
import com.mrgris.resample.strategy.NearestNeighborStrategy;

public class RegionResamplerTest {

	static final float ND = -9999f;

	static class RecordingFormat implements GridFormat {
		List<String> written = new ArrayList<String>();

		@Override
		public Grid read(Path path) {
			throw new UnsupportedOperationException();
		}

		@Override
		public void write(Grid grid, Path path) {
			written.add(path.getFileName().toString());
		}
	}

	static RegionResampler nn() {
		return new RegionResampler(new NearestNeighborStrategy(ConflictMethod.ARITHMETIC_AVERAGE, true), true);
	}

	// three regions of zone 1 and one of zone 2
	static final float[][] ZONES = {{1, 1, 0, 1, 0, 2, 0, 1}};
	static final float[][] VALUES = {{5, ND, ND, ND, ND, ND, ND, ND}};

	@Test
	public void testRegionsWithoutValuesStayEmpty() {
		Grid result = nn().resample(Grid.of(VALUES, 1, ND), Grid.of(ZONES, 1, 0f));
		assertArrayEquals(new float[] {5, 5, ND, ND, ND, ND, ND, ND}, result.values[0], 0f);
	}

	@Test
	public void testSubZoneNumbering() {
		RecordingFormat format = new RecordingFormat();
		RegionResampler resampler = nn();
		resampler.enableDebug(format, Paths.get("debug"), ".asc", null);

		resampler.resample(Grid.of(VALUES, 1, ND), Grid.of(ZONES, 1, 0f));

		assertEquals(12, format.written.size());
		assertTrue(format.written.contains("LocalResult1.0.1.asc"));
		assertTrue(format.written.contains("LocalResult1.0.2.asc"));
		assertTrue(format.written.contains("LocalResult1.0.3.asc"));
		assertTrue(format.written.contains("LocalResult2.0.1.asc"));
	}

	@Test
	public void testSignedZeroSharesSubZoneCounter() {
		RecordingFormat format = new RecordingFormat();
		RegionResampler resampler = nn();
		resampler.enableDebug(format, Paths.get("debug"), ".asc", null);

		resampler.resample(Grid.of(new float[][] {{ND, ND, ND}}, 1, ND), Grid.of(new float[][] {{0f, 9, -0f}}, 1, ND));

		assertTrue(format.written.contains("LocalResult0.0.1.asc"));
		assertTrue(format.written.contains("LocalResult0.0.2.asc"));
		assertFalse(format.written.contains("LocalResult-0.0.1.asc"));
	}

	@Test
	public void testDebugOfOneSubZone() {
		RecordingFormat format = new RecordingFormat();
		RegionResampler resampler = nn();
		resampler.enableDebug(format, Paths.get("debug"), ".asc", "1.0.2");

		resampler.resample(Grid.of(VALUES, 1, ND), Grid.of(ZONES, 1, 0f));

		assertEquals(3, format.written.size());
		assertEquals("LocalValues1.0.2.asc", format.written.get(0));
	}

	@Test
	public void testFailingDebugOutputIsNotFatal() {
		RegionResampler resampler = nn();
		resampler.enableDebug(new GridFormat() {
			@Override
			public Grid read(Path path) {
				throw new UnsupportedOperationException();
			}

			@Override
			public void write(Grid grid, Path path) {
				throw new ResampleException("disk full");
			}
		}, Paths.get("debug"), ".asc", null);

		Grid result = resampler.resample(Grid.of(VALUES, 1, ND), Grid.of(ZONES, 1, 0f));
		assertEquals(5f, result.get(0, 1), 0f);
	}
}
