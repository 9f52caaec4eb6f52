package com.mrgris.resample;

public enum ResampleMethod {
	NEAREST_NEIGHBOR(1, "nn"),
	IDW(2, "idw"),
	MINIMUM_VALUE(3, "min"),
	MAXIMUM_VALUE(4, "max"),
	MEAN_VALUE(5, "mean"),
	PERCENTILE_VALUE(6, "perc");

	public final int number;
	public final String key;

	ResampleMethod(int number, String key) {
		this.number = number;
		this.key = key;
	}

	// nearest neighbor and IDW work per connected region; the others per zone value
	public boolean isRegional() {
		return this == NEAREST_NEIGHBOR || this == IDW;
	}

	/* accepts the short key, the method number or the enum name */
	public static ResampleMethod parse(String s) {
		String t = s.trim();
		for (ResampleMethod m : values()) {
			if (m.key.equalsIgnoreCase(t) || m.name().equalsIgnoreCase(t) || Integer.toString(m.number).equals(t)) {
				return m;
			}
		}
		throw new ResampleException("invalid resample method: " + s);
	}
}
