package com.gt.chamlang.session;

import com.gt.chamlang.model.PracticeSession;
import com.gt.chamlang.session.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/practice")
public class PracticeSessionController {

    private static final Logger log = LoggerFactory.getLogger(PracticeSessionController.class);

    private final PracticeSessionService practiceSessionService;

    public PracticeSessionController(PracticeSessionService practiceSessionService) {
        this.practiceSessionService = practiceSessionService;
    }

    @PostMapping(value = "/startSession", consumes = "application/json", produces = "application/json")
    public PracticeSessionView startSession(@RequestBody StartSessionRequest request) {
        return practiceSessionService.startSession(
                request.language(),
                request.collectionId(),
                request.mode(),
                request.topic(),
                request.level(),
                request.candidates(),
                request.limit());
    }

    @GetMapping(value = "/session", produces = "application/json")
    public PracticeSessionView getSession(@RequestParam(value = "sessionId") String sessionId) {
        return practiceSessionService.getSession(sessionId);
    }

    @PostMapping(value = "/answer", consumes = "application/json", produces = "application/json")
    public AnswerResult answer(@RequestBody AnswerRequest request) {
        return practiceSessionService.recordAnswer(
                request.sessionId(),
                request.vocabularyId(),
                request.mode(),
                request.correct(),
                request.timeSpentSeconds());
    }

    @PostMapping(value = "/skip", consumes = "application/json", produces = "application/json")
    public PracticeSessionView skipWord(@RequestBody SkipWordRequest request) {
        return practiceSessionService.skipWord(request.sessionId(), request.vocabularyId());
    }

    @PostMapping(value = "/completeSession", consumes = "application/json", produces = "application/json")
    public SessionSummary completeSession(@RequestBody SessionIdRequest request) {
        return practiceSessionService.completeSession(request.sessionId());
    }

    @PostMapping(value = "/abandonSession", consumes = "application/json")
    public void abandonSession(@RequestBody SessionIdRequest request) {
        practiceSessionService.abandonSession(request.sessionId());
    }

    @PostMapping(value = "/submitSession", consumes = "application/json", produces = "application/json")
    public SessionSummary submitSession(@RequestBody SubmitSessionRequest request) {
        log.debug("Received client session with {} results", request.results() == null ? 0 : request.results().size());

        return practiceSessionService.submitSession(
                request.language(),
                request.collectionId(),
                request.mode(),
                request.topic(),
                request.level(),
                request.results(),
                request.startedAt(),
                request.completedAt());
    }

    @GetMapping(value = "/recentSessions", produces = "application/json")
    public List<PracticeSession> getRecentSessions(@RequestParam(value = "language") String language,
                                                   @RequestParam(value = "maxSessionCnt", defaultValue = "20") int maxSessionCnt) {
        return practiceSessionService.getRecentSessions(language, maxSessionCnt);
    }

    private record StartSessionRequest(String language, String collectionId, String mode, String topic, String level,
                                       List<VocabularyCandidate> candidates, Integer limit) { }
    private record AnswerRequest(String sessionId, String vocabularyId, String mode, boolean correct, int timeSpentSeconds) { }
    private record SkipWordRequest(String sessionId, String vocabularyId) { }
    private record SessionIdRequest(String sessionId) { }
    private record SubmitSessionRequest(String language, String collectionId, String mode, String topic, String level,
                                        List<ClientPracticeResult> results, Instant startedAt, Instant completedAt) { }
}
