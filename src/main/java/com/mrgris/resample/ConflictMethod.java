package com.mrgris.resample;

/* how a nearest-neighbor cell combines the values of several resolved neighbors */
public enum ConflictMethod {
	ARITHMETIC_AVERAGE(1),
	HARMONIC_AVERAGE(2),
	MINIMUM_VALUE(3),
	MAXIMUM_VALUE(4);

	public final int number;

	ConflictMethod(int number) {
		this.number = number;
	}

	public static ConflictMethod fromNumber(int number) {
		for (ConflictMethod m : values()) {
			if (m.number == number) {
				return m;
			}
		}
		throw new ResampleException("invalid conflict method number (1-4): " + number);
	}
}
