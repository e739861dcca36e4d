package com.gt.chamlang.progress;

import com.gt.chamlang.model.UserPracticeProgress;

import java.util.Optional;

public interface UserPracticeProgressDao {

    // The returned aggregate carries counters only; word progress is loaded through WordProgressDao.
    Optional<UserPracticeProgress> loadPracticeProgress(String language);

    void savePracticeProgress(UserPracticeProgress practiceProgress);
}
