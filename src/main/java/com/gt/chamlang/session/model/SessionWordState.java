package com.gt.chamlang.session.model;

public record SessionWordState(int retryCount, boolean failedInSession, boolean answeredCorrectly) {

    public static final SessionWordState UNTOUCHED = new SessionWordState(0, false, false);
}
