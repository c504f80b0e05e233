package com.study.webflux.recall.domain.memory.port;

import java.util.List;

import com.study.webflux.recall.domain.memory.model.MemoryRecord;
import com.study.webflux.recall.domain.memory.model.ScoredMemory;
import com.study.webflux.recall.domain.query.model.NamedVector;
import com.study.webflux.recall.domain.query.model.TemporalWindow;
import com.study.webflux.recall.domain.user.model.UserId;
import reactor.core.publisher.Flux;

public interface MemoryVectorPort {

	/**
	 * 지정한 이름 벡터로 사용자 기억을 코사인 유사도 내림차순으로 조회합니다.
	 */
	Flux<ScoredMemory> search(UserId userId, NamedVector vector, List<Float> queryVector, int limit);

	/**
	 * 시간 범위 안의 기억을 방향에 맞게 정렬하여 조회합니다. OLDEST 는 오름차순, NEWEST 는 내림차순입니다.
	 */
	Flux<MemoryRecord> scrollChronological(UserId userId, TemporalWindow window);
}
