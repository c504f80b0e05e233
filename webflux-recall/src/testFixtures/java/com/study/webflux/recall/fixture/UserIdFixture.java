package com.study.webflux.recall.fixture;

import com.study.webflux.recall.domain.user.model.UserId;

public final class UserIdFixture {

	public static final String DEFAULT_USER_ID = "user-1";
	public static final String OTHER_USER_ID = "user-2";

	private UserIdFixture() {
	}

	public static UserId create() {
		return UserId.of(DEFAULT_USER_ID);
	}

	/**
	 * 사용자별 격리를 확인할 때 쓰는 두 번째 사용자입니다.
	 */
	public static UserId other() {
		return UserId.of(OTHER_USER_ID);
	}

	public static UserId create(String userId) {
		return UserId.of(userId);
	}
}
