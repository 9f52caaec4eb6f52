package com.mrgris.resample.grid;

import java.util.Objects;

/* axis-aligned bounding box in world coordinates */
public class Extent {

	public final double xmin;
	public final double ymin;
	public final double xmax;
	public final double ymax;

	public Extent(double xmin, double ymin, double xmax, double ymax) {
		if (xmax < xmin || ymax < ymin) {
			throw new IllegalArgumentException(String.format("invalid extent (%s,%s)-(%s,%s)", xmin, ymin, xmax, ymax));
		}
		this.xmin = xmin;
		this.ymin = ymin;
		this.xmax = xmax;
		this.ymax = ymax;
	}

	public double width() {
		return xmax - xmin;
	}

	public double height() {
		return ymax - ymin;
	}

	public boolean intersects(Extent e) {
		return this.xmin < e.xmax && e.xmin < this.xmax &&
			   this.ymin < e.ymax && e.ymin < this.ymax;
	}

	public boolean equals(Object o) {
		if (o instanceof Extent) {
			Extent e = (Extent)o;
			return this.xmin == e.xmin && this.ymin == e.ymin && this.xmax == e.xmax && this.ymax == e.ymax;
		} else {
			return false;
		}
	}

	public int hashCode() {
		return Objects.hash(xmin, ymin, xmax, ymax);
	}

	public String toString() {
		return String.format("(%s,%s)-(%s,%s)", xmin, ymin, xmax, ymax);
	}
}
