package com.gt.chamlang.progress;

import com.gt.chamlang.model.WordProgress;

import java.util.Collection;
import java.util.List;

public interface WordProgressDao {

    List<WordProgress> loadWordProgress(String language);

    List<WordProgress> loadWordProgressBatch(String language, Collection<String> vocabularyIds);

    void saveWordProgress(String language, WordProgress wordProgress);

    int saveWordProgressBatch(String language, Collection<WordProgress> wordProgress);
}
