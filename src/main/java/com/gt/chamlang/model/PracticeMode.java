package com.gt.chamlang.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.chamlang.serialization.PracticeModeSerializer;

@JsonSerialize(using = PracticeModeSerializer.class)
public enum PracticeMode {
    Flashcard("flashcard"),
    FillWord("fillword"),
    MultipleChoice("multiplechoice");

    private final String tag;

    PracticeMode(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static PracticeMode fromTag(String tag) {
        if (tag == null) {
            return null;
        }

        for (PracticeMode practiceMode : values()) {
            if (practiceMode.tag.equalsIgnoreCase(tag.trim())) {
                return practiceMode;
            }
        }

        return null;
    }
}
