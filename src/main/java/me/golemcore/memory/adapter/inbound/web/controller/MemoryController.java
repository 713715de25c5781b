package me.golemcore.memory.adapter.inbound.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import me.golemcore.memory.adapter.inbound.web.dto.CoreMemoryRequest;
import me.golemcore.memory.adapter.inbound.web.dto.DiaryEntryRequest;
import me.golemcore.memory.adapter.inbound.web.dto.InteractionRequest;
import me.golemcore.memory.conversation.DiaryCandidate;
import me.golemcore.memory.conversation.DiaryDecision;
import me.golemcore.memory.domain.model.DiaryEntry;
import me.golemcore.memory.domain.service.MemoryCoreService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Conversational memory of an owner: interactions, core facts, diary, memory
 * search and statistics.
 *
 * <p>
 * Store operations block on disk and model calls, so they run on the
 * bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api/memory/{ownerId}")
@RequiredArgsConstructor
public class MemoryController {

    private final MemoryCoreService memoryCoreService;

    @PostMapping("/interactions")
    public Mono<ResponseEntity<Void>> addInteraction(@PathVariable String ownerId,
            @Valid @RequestBody InteractionRequest request) {
        return Mono.fromCallable(() -> {
            memoryCoreService.addInteraction(ownerId, request.getUserMessage(), request.getAssistantMessage(),
                    request.isSaveToLongTerm(), request.getImportance());
            return ResponseEntity.accepted().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/core")
    public Mono<ResponseEntity<AddedResponse>> addCoreMemory(@PathVariable String ownerId,
            @Valid @RequestBody CoreMemoryRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(new AddedResponse(memoryCoreService.addCoreMemory(ownerId,
                request.getContent(), request.getCategory(), request.getImportance()))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/diary")
    public Mono<ResponseEntity<DiaryDecisionResponse>> addDiaryEntry(@PathVariable String ownerId,
            @Valid @RequestBody DiaryEntryRequest request) {
        return Mono.fromCallable(() -> {
            DiaryCandidate candidate = new DiaryCandidate(request.getContent(), request.getImportance(),
                    request.getEmotion(), request.getPeople(), request.getLocation(), request.getEvent());
            DiaryDecision decision = memoryCoreService.addDiaryEntry(ownerId, candidate);
            return ResponseEntity.ok(new DiaryDecisionResponse(decision.isSaved(), decision.name()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/diary/summary")
    public Mono<ResponseEntity<DiaryEntry>> generateDailySummary(@PathVariable String ownerId,
            @RequestParam(defaultValue = "false") boolean force) {
        return Mono.fromCallable(() -> memoryCoreService.generateDailySummary(ownerId, force)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/search")
    public Mono<ResponseEntity<List<String>>> searchMemories(@PathVariable String ownerId,
            @RequestParam String query, @RequestParam(defaultValue = "5") int k) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.searchMemories(ownerId, query, k)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/retrieve")
    public Mono<ResponseEntity<Map<String, List<String>>>> retrieve(@PathVariable String ownerId,
            @RequestParam String query, @RequestBody(required = false) Map<String, Integer> perSourceK) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.retrieve(ownerId, query,
                perSourceK != null ? perSourceK : Map.of())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<MemoryCoreService.MemoryStats>> getStats(@PathVariable String ownerId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryCoreService.getStats(ownerId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    record AddedResponse(boolean added) {
    }

    record DiaryDecisionResponse(boolean saved, String decision) {
    }
}
