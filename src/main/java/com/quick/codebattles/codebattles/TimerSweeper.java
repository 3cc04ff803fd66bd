package com.quick.codebattles.codebattles;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TimerSweeper {

    private final GameDispatcher dispatcher;

    @Scheduled(fixedDelayString = "${codebattles.timer.check-ms:1000}")
    public void checkTimers() {
        dispatcher.sweepExpiredTimers();
    }
}
