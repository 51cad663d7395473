package com.gt.quranquest.session;

import com.gt.quranquest.model.ConfidenceLevel;
import com.gt.quranquest.model.TestResult;
import com.gt.quranquest.model.Verse;
import com.gt.quranquest.model.VerseLearningState;
import com.gt.quranquest.session.model.LearningSession;
import com.gt.quranquest.session.model.SessionItem;
import com.gt.quranquest.session.model.SessionProgress;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/session")
public class LearningSessionController {

    private final LearningSessionService learningSessionService;

    public LearningSessionController(LearningSessionService learningSessionService) {
        this.learningSessionService = learningSessionService;
    }

    @PostMapping("initialize")
    public LearningSession initializeSession(@RequestBody InitializeSessionRequest request) {
        return learningSessionService.initializeSession(
                request.chapterId(),
                request.chapterLabel(),
                request.verses() == null ? List.of() : request.verses(),
                request.startNum(),
                request.endNum());
    }

    @GetMapping("current")
    public ResponseEntity<SessionItem> currentItem() {
        return ResponseEntity.of(learningSessionService.currentItem());
    }

    @PostMapping("next")
    public ResponseEntity<SessionItem> nextItem() {
        return ResponseEntity.of(learningSessionService.nextItem());
    }

    @PostMapping("previous")
    public ResponseEntity<SessionItem> previousItem() {
        return ResponseEntity.of(learningSessionService.previousItem());
    }

    @PostMapping("goTo")
    public ResponseEntity<SessionItem> goToItem(@RequestParam(value = "index") int index) {
        return ResponseEntity.of(learningSessionService.goToItem(index));
    }

    @GetMapping("progress")
    public SessionProgress sessionProgress() {
        return learningSessionService.sessionProgress();
    }

    @PostMapping("complete")
    public ResponseEntity<LearningSession> completeSession() {
        return ResponseEntity.of(learningSessionService.completeSession());
    }

    @PostMapping("reset")
    public void resetSession() {
        learningSessionService.resetSession();
    }

    @PostMapping("markRead")
    public ResponseEntity<VerseLearningState> markRead(@RequestParam(value = "verseId") int verseId) {
        return ResponseEntity.of(learningSessionService.markRead(verseId));
    }

    @PostMapping("setConfidence")
    public VerseLearningState setConfidence(@RequestBody SetConfidenceRequest request) {
        return learningSessionService.setConfidence(request.verseId(), request.confidence());
    }

    @PostMapping("startTest")
    public VerseLearningState startTest(@RequestParam(value = "verseId") int verseId) {
        return learningSessionService.startTest(verseId);
    }

    @PostMapping("submitTestResult")
    public VerseLearningState submitTestResult(@RequestBody TestResult testResult) {
        return learningSessionService.submitTestResult(testResult);
    }

    private record InitializeSessionRequest(int chapterId, String chapterLabel, List<Verse> verses, int startNum, int endNum) { }
    private record SetConfidenceRequest(int verseId, ConfidenceLevel confidence) { }
}
