package com.study.webflux.recall.domain.error;

import java.time.Duration;

public class BackendTimeoutException extends RecallException {

	private final Backend backend;

	public BackendTimeoutException(Backend backend, Duration timeout, Throwable cause) {
		super(backend + " did not respond within " + timeout.toMillis() + "ms", cause);
		this.backend = backend;
	}

	public Backend backend() {
		return backend;
	}
}
