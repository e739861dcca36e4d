package com.gt.chamlang.model;

import java.time.Instant;

public record AnswerOutcome(boolean correct, PracticeMode mode, Instant answeredAt) { }
