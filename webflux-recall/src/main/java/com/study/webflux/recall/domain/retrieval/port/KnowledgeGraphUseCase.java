package com.study.webflux.recall.domain.retrieval.port;

import com.study.webflux.recall.domain.knowledge.model.FactFilter;
import com.study.webflux.recall.domain.knowledge.model.FactWriteOutcome;
import com.study.webflux.recall.domain.knowledge.model.RelatedEntity;
import com.study.webflux.recall.domain.knowledge.model.StoreFactCommand;
import com.study.webflux.recall.domain.knowledge.model.UserFact;
import com.study.webflux.recall.domain.user.model.UserId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface KnowledgeGraphUseCase {

	Flux<UserFact> getUserFacts(UserId userId, FactFilter filter, int limit);

	Mono<FactWriteOutcome> storeFact(StoreFactCommand command);

	Flux<RelatedEntity> getRelatedEntities(String entityName, int maxHops);
}
