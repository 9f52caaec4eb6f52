package com.mrgris.resample.util;

import java.util.HashMap;

// NOT THREAD-SAFE; the resampling run is single-threaded and get() enforces that

public abstract class DefaultMap<K, V> extends HashMap<K, V> {
	private static final long serialVersionUID = 1L;

	long threadId = -1;

	/* value for the key, creating and storing the default value on first access */
	@Override
	public V get(Object key) {
		threadSafetyCheck();

		if (!this.containsKey(key)) {
			this.put((K)key, this.defaultValue((K)key));
		}
		return super.get(key);
	}

	void threadSafetyCheck() {
		long current = Thread.currentThread().getId();
		if (threadId == -1) {
			threadId = current;
		} else if (current != threadId) {
			throw new IllegalStateException("DefaultMap accessed from thread " + current + ", owned by thread " + threadId);
		}
	}

	public abstract V defaultValue(K key);
}
