package com.gt.chamlang.session.model;

import com.gt.chamlang.model.PracticeMode;

import java.time.Instant;
import java.util.List;

public record PracticeSessionView(String sessionId,
                                  String language,
                                  String collectionId,
                                  PracticeMode mode,
                                  List<String> queue,
                                  List<String> deferred,
                                  int answeredCount,
                                  Instant startedAt) { }
