package com.gt.quranquest.progress;

import com.gt.quranquest.model.VerseLearningState;
import com.gt.quranquest.progress.model.ChapterProgress;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/progress")
public class VerseProgressController {

    private final VerseProgressTracker verseProgressTracker;

    public VerseProgressController(VerseProgressTracker verseProgressTracker) {
        this.verseProgressTracker = verseProgressTracker;
    }

    @GetMapping(value = "/verse", produces = "application/json")
    public ResponseEntity<VerseLearningState> getVerseState(@RequestParam(value = "verseId") int verseId) {
        return ResponseEntity.of(verseProgressTracker.getState(verseId));
    }

    @GetMapping(value = "/chapter", produces = "application/json")
    public ChapterProgress getChapterProgress(@RequestParam(value = "chapterId") int chapterId,
                                              @RequestParam(value = "totalVerses") int totalVerses) {
        return verseProgressTracker.getChapterProgress(chapterId, totalVerses);
    }
}
