package com.gt.quranquest.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a learning operation addresses a verse that has no learning state yet
@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class UntrackedVerseException extends RuntimeException {

    private final int verseId;

    public UntrackedVerseException(int verseId, String operation) {
        super("Cannot " + operation + " for verse " + verseId + ": verse has no learning state");
        this.verseId = verseId;
    }

    public int getVerseId() {
        return verseId;
    }
}
