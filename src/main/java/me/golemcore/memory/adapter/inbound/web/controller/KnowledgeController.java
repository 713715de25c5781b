package me.golemcore.memory.adapter.inbound.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import me.golemcore.memory.adapter.inbound.web.dto.FeedbackRequest;
import me.golemcore.memory.adapter.inbound.web.dto.LearnTextRequest;
import me.golemcore.memory.adapter.inbound.web.dto.RecommendRequest;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.RelatedKnowledge;
import me.golemcore.memory.domain.service.MemoryCoreService;
import me.golemcore.memory.knowledge.ImportReport;
import me.golemcore.memory.knowledge.KnowledgeHit;
import me.golemcore.memory.recommend.PushedKnowledge;
import me.golemcore.memory.recommend.Recommendation;
import me.golemcore.memory.recommend.RecommendationContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Knowledge base of an owner: entries, search, graph neighbours,
 * recommendations and proactive pushes.
 */
@RestController
@RequestMapping("/api/memory/{ownerId}/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

    private final MemoryCoreService memoryCoreService;

    @GetMapping("/search")
    public Mono<ResponseEntity<List<KnowledgeHit>>> search(@PathVariable String ownerId,
            @RequestParam String query, @RequestParam(defaultValue = "5") int k,
            @RequestParam(required = false) String category) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.searchKnowledge(ownerId, query, k,
                category)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping
    public Mono<ResponseEntity<IdResponse>> add(@PathVariable String ownerId, @RequestBody KnowledgeEntry draft) {
        return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(new IdResponse(memoryCoreService.addKnowledge(ownerId, draft))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/learn")
    public Mono<ResponseEntity<List<String>>> learn(@PathVariable String ownerId,
            @Valid @RequestBody LearnTextRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.learnFromText(ownerId, request.getText(),
                request.getCategory(), request.getSource())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<KnowledgeEntry>> get(@PathVariable String ownerId, @PathVariable String id) {
        return Mono.fromCallable(() -> memoryCoreService.getKnowledge(ownerId, id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> notFound(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<Void>> update(@PathVariable String ownerId, @PathVariable String id,
            @RequestBody KnowledgeEntry patch) {
        return Mono.fromCallable(() -> {
            if (!memoryCoreService.updateKnowledge(ownerId, id, patch)) {
                throw notFound(id);
            }
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String ownerId, @PathVariable String id) {
        return Mono.fromCallable(() -> {
            if (!memoryCoreService.deleteKnowledge(ownerId, id)) {
                throw notFound(id);
            }
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/feedback")
    public Mono<ResponseEntity<Void>> feedback(@PathVariable String ownerId, @PathVariable String id,
            @RequestBody FeedbackRequest request) {
        return Mono.fromCallable(() -> {
            String userId = request.getUserId() != null ? request.getUserId() : "default";
            if (!memoryCoreService.recordFeedback(ownerId, userId, id, request.isPositive())) {
                throw notFound(id);
            }
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}/related")
    public Mono<ResponseEntity<List<RelatedKnowledge>>> related(@PathVariable String ownerId,
            @PathVariable String id, @RequestParam(defaultValue = "2") int maxDepth,
            @RequestParam(defaultValue = "0.5") double minConfidence) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.findRelated(ownerId, id, maxDepth,
                minConfidence)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/export")
    public Mono<ResponseEntity<List<KnowledgeEntry>>> export(@PathVariable String ownerId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.exportKnowledge(ownerId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/import")
    public Mono<ResponseEntity<ImportReport>> importRecords(@PathVariable String ownerId,
            @RequestParam(defaultValue = "false") boolean overwrite, @RequestBody List<KnowledgeEntry> records) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.importKnowledge(ownerId, records,
                overwrite)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/recommend")
    public Mono<ResponseEntity<List<Recommendation>>> recommend(@PathVariable String ownerId,
            @Valid @RequestBody RecommendRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.recommend(ownerId, toContext(request),
                request.getK())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/push")
    public Mono<ResponseEntity<List<PushedKnowledge>>> push(@PathVariable String ownerId,
            @Valid @RequestBody RecommendRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.pushKnowledge(ownerId,
                toContext(request), request.getK())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    static RecommendationContext toContext(RecommendRequest request) {
        RecommendationContext.RecommendationContextBuilder builder = RecommendationContext.builder()
                .query(request.getQuery())
                .topic(request.getTopic())
                .userMessage(request.getUserMessage())
                .lastUsedKnowledgeId(request.getLastUsedKnowledgeId());
        if (request.getKeywords() != null) {
            builder.keywords(List.copyOf(request.getKeywords()));
        }
        if (request.getRecentTopics() != null) {
            builder.recentTopics(List.copyOf(request.getRecentTopics()));
        }
        if (request.getUserId() != null && !request.getUserId().isBlank()) {
            builder.userId(request.getUserId());
        }
        return builder.build();
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Knowledge entry not found: " + id);
    }

    record IdResponse(String id) {
    }
}
