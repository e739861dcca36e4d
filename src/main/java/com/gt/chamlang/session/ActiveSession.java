package com.gt.chamlang.session;

import com.gt.chamlang.model.LearningSettings;
import com.gt.chamlang.model.PracticeMode;
import com.gt.chamlang.model.PracticeResult;
import com.gt.chamlang.model.WordProgress;
import com.gt.chamlang.scheduling.SchedulingAlgorithm;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

// Mutable state of a running session. Callers hold the instance lock while reading or changing it.
class ActiveSession {

    final String id;
    final String language;
    final String collectionId;
    final PracticeMode mode;
    final String topic;
    final String level;
    final Instant startedAt;
    final LearningSettings settings;
    final SchedulingAlgorithm schedulingAlgorithm;
    final Map<String, WordProgress> progressAtStart;
    final Map<String, WordProgress> progress;
    final Map<String, String> words;
    final List<PracticeResult> results = new ArrayList<>();
    QueueState queueState;
    Instant lastTouched;
    boolean closed;

    ActiveSession(String id,
                  String language,
                  String collectionId,
                  PracticeMode mode,
                  String topic,
                  String level,
                  Instant startedAt,
                  LearningSettings settings,
                  SchedulingAlgorithm schedulingAlgorithm,
                  Map<String, WordProgress> progressAtStart,
                  Map<String, WordProgress> progress,
                  Map<String, String> words,
                  QueueState queueState) {
        this.id = id;
        this.language = language;
        this.collectionId = collectionId;
        this.mode = mode;
        this.topic = topic;
        this.level = level;
        this.startedAt = startedAt;
        this.settings = settings;
        this.schedulingAlgorithm = schedulingAlgorithm;
        this.progressAtStart = progressAtStart;
        this.progress = progress;
        this.words = words;
        this.queueState = queueState;
        this.lastTouched = startedAt;
    }
}
