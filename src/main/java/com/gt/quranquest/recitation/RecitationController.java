package com.gt.quranquest.recitation;

import com.gt.quranquest.recitation.model.RecitationAnalysis;
import com.gt.quranquest.recitation.model.RecitationTestOutcome;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/recitation")
public class RecitationController {

    private final RecitationService recitationService;

    public RecitationController(RecitationService recitationService) {
        this.recitationService = recitationService;
    }

    @PostMapping(value = "/analyze", consumes = "application/json", produces = "application/json")
    public RecitationAnalysis analyze(@RequestBody AnalyzeRequest request) {
        return recitationService.analyze(request.expectedText(), request.transcription());
    }

    @PostMapping(value = "/test", consumes = "application/json", produces = "application/json")
    public RecitationTestOutcome submitRecitationTest(@RequestBody RecitationTestRequest request) {
        return recitationService.submitRecitationTest(request.verseId(), request.expectedText(), request.transcription(), request.durationSeconds());
    }

    private record AnalyzeRequest(String expectedText, String transcription) { }
    private record RecitationTestRequest(int verseId, String expectedText, String transcription, long durationSeconds) { }
}
