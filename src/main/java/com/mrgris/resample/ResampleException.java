package com.mrgris.resample;

/* invalid configuration or input; aborts processing of the current file */
public class ResampleException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ResampleException(String message) {
		super(message);
	}

	public ResampleException(String message, Throwable cause) {
		super(message, cause);
	}
}
