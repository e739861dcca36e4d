package com.gt.chamlang.progress.model;

public record BoxCount(int boxNumber, int wordCount, int percentage) { }
