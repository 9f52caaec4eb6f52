package com.mrgris.resample.strategy;

import java.util.Arrays;
import java.util.List;

import com.google.common.primitives.Floats;
import com.mrgris.resample.ResampleException;
import com.mrgris.resample.ResampleMethod;

/* one of the zonal statistics (min, max, mean, percentile) over a population of cell values */
public class ZoneStatistic {

	public final ResampleMethod method;
	public final int percentile;

	public ZoneStatistic(ResampleMethod method, Integer percentile) {
		if (method.isRegional()) {
			throw new ResampleException("not a zone statistic: " + method);
		}
		if (method == ResampleMethod.PERCENTILE_VALUE) {
			if (percentile == null) {
				throw new ResampleException("percentile is required for the percentile resample method");
			}
			if (percentile < 0 || percentile > 100) {
				throw new ResampleException("invalid percentile value for percentile resample method: " + percentile);
			}
		}
		this.method = method;
		this.percentile = (percentile != null ? percentile : -1);
	}

	/**
	 * @param values non-empty, in the order the cells were visited
	 */
	public float compute(List<Float> values) {
		if (values.isEmpty()) {
			throw new IllegalArgumentException("no values");
		}
		float[] v = Floats.toArray(values);
		switch (method) {
		case MINIMUM_VALUE:
			return Floats.min(v);
		case MAXIMUM_VALUE:
			return Floats.max(v);
		case MEAN_VALUE:
			float sum = 0;
			for (float f : v) {
				sum += f;
			}
			return sum / v.length;
		case PERCENTILE_VALUE:
			// nearest rank, not interpolated
			Arrays.sort(v);
			int ix = (int)Math.min((long)percentile * v.length / 100, v.length - 1);
			return v[ix];
		default:
			throw new IllegalStateException("undefined resample method for zone statistics: " + method);
		}
	}

	public String toString() {
		return (method == ResampleMethod.PERCENTILE_VALUE ? "percentile " + percentile : method.key);
	}
}
