package com.gt.quranquest.lesson;

import com.gt.quranquest.lesson.model.ExerciseAnswer;
import com.gt.quranquest.lesson.model.Lesson;
import com.gt.quranquest.lesson.model.LessonResult;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/lesson")
public class LessonController {

    private final LessonRewardCalculator lessonRewardCalculator;

    public LessonController(LessonRewardCalculator lessonRewardCalculator) {
        this.lessonRewardCalculator = lessonRewardCalculator;
    }

    @PostMapping("start")
    public void startLesson(@RequestBody Lesson lesson) {
        lessonRewardCalculator.startLesson(lesson);
    }

    @PostMapping("answer")
    public AnswerResponse submitAnswer(@RequestBody ExerciseAnswer answer) {
        boolean correct = lessonRewardCalculator.submitAnswer(answer);
        return new AnswerResponse(correct, lessonRewardCalculator.getCombo(), lessonRewardCalculator.getHeartsUsed());
    }

    @PostMapping("complete")
    public LessonResult completeLesson() {
        return lessonRewardCalculator.complete();
    }

    @PostMapping("reset")
    public void resetLesson() {
        lessonRewardCalculator.resetLesson();
    }

    private record AnswerResponse(boolean isCorrect, int combo, int heartsUsed) { }
}
