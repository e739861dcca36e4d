package com.gt.chamlang.progress.model;

import com.gt.chamlang.model.WordProgress;
import com.gt.chamlang.model.WordStatus;

public record WordProgressView(WordProgress progress, WordStatus status, boolean due) { }
