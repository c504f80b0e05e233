package com.study.webflux.recall.application.knowledge.controller;

import java.util.Set;

import lombok.RequiredArgsConstructor;

import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.recall.application.knowledge.controller.docs.KnowledgeApi;
import com.study.webflux.recall.application.knowledge.dto.FactResponse;
import com.study.webflux.recall.application.knowledge.dto.RelatedEntityResponse;
import com.study.webflux.recall.application.knowledge.dto.StoreFactRequest;
import com.study.webflux.recall.domain.knowledge.model.FactEntity;
import com.study.webflux.recall.domain.knowledge.model.FactFilter;
import com.study.webflux.recall.domain.retrieval.port.KnowledgeGraphUseCase;
import com.study.webflux.recall.domain.user.model.UserId;
import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/recall")
public class KnowledgeController implements KnowledgeApi {

	private final KnowledgeGraphUseCase knowledgeGraphUseCase;

	@PostMapping("/facts")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public Mono<Void> storeFact(@Valid @RequestBody StoreFactRequest request) {
		return Mono.fromSupplier(request::toCommand)
			.flatMap(knowledgeGraphUseCase::storeFact)
			.then()
			.onErrorMap(IllegalArgumentException.class,
				error -> new ResponseStatusException(HttpStatus.BAD_REQUEST, error.getMessage()));
	}

	@GetMapping("/facts/{userId}")
	public Flux<FactResponse> getUserFacts(@PathVariable String userId,
		@RequestParam(required = false) String entityType,
		@RequestParam(required = false) String relationshipType,
		@RequestParam(defaultValue = "0.5") double minConfidence,
		@RequestParam(defaultValue = "20") int limit) {
		return Mono.fromSupplier(() -> FactFilter.of(entityType,
			relationshipType == null || relationshipType.isBlank()
				? Set.of()
				: Set.of(FactEntity.normalize(relationshipType)),
			minConfidence))
			.flatMapMany(filter -> knowledgeGraphUseCase.getUserFacts(UserId.of(userId), filter, limit))
			.map(FactResponse::from)
			.onErrorMap(IllegalArgumentException.class,
				error -> new ResponseStatusException(HttpStatus.BAD_REQUEST, error.getMessage()));
	}

	@GetMapping("/entities/{name}/related")
	public Flux<RelatedEntityResponse> getRelatedEntities(@PathVariable String name,
		@RequestParam(defaultValue = "2") int maxHops) {
		return knowledgeGraphUseCase.getRelatedEntities(name, maxHops)
			.map(RelatedEntityResponse::from)
			.onErrorMap(IllegalArgumentException.class,
				error -> new ResponseStatusException(HttpStatus.BAD_REQUEST, error.getMessage()));
	}
}
