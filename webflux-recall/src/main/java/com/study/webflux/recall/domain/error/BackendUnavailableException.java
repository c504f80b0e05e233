package com.study.webflux.recall.domain.error;

/**
 * 외부 저장소나 모델에 접근할 수 없을 때 발생합니다.
 */
public class BackendUnavailableException extends RecallException {

	private final Backend backend;

	public BackendUnavailableException(Backend backend, String message) {
		super(backend + " unavailable: " + message);
		this.backend = backend;
	}

	public BackendUnavailableException(Backend backend, String message, Throwable cause) {
		super(backend + " unavailable: " + message, cause);
		this.backend = backend;
	}

	public Backend backend() {
		return backend;
	}
}
