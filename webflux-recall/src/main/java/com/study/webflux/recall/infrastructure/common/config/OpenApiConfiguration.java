package com.study.webflux.recall.infrastructure.common.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;

/**
 * 조회 라우터와 지식 그래프 엔드포인트를 하나의 문서로 노출합니다. 태그 이름은 각 API 인터페이스의 {@code @Tag} 와 같아야 합니다.
 */
@Configuration
public class OpenApiConfiguration {

	static final String RECALL_TAG = "기억 조회 API";
	static final String KNOWLEDGE_TAG = "지식 그래프 API";

	@Bean
	public OpenAPI openAPI(@Value("${spring.application.name:recall-router}") String applicationName) {
		return new OpenAPI()
			.info(new Info()
				.title("Recall Router API")
				.description(applicationName
					+ ": 질의를 TEMPORAL/FACTUAL/EMOTIONAL/CONVERSATIONAL/GENERAL 로 분류하고"
					+ " 시간순 조회, 이름 벡터 융합 검색, 지식 그래프 사실 조회를 조합하여 대화 컨텍스트를 반환합니다."
					+ " 일부 저장소가 실패하면 components 에 상태를 표시하고 남은 결과로 응답합니다.")
				.version("1.0.0"))
			.tags(List.of(
				new Tag().name(RECALL_TAG).description("POST /recall/classify, POST /recall/retrieve"),
				new Tag().name(KNOWLEDGE_TAG)
					.description("POST /recall/facts, GET /recall/facts/{userId}, GET /recall/entities/{name}/related")));
	}
}
