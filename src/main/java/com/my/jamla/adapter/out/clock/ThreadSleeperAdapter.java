package com.my.jamla.adapter.out.clock;

import com.my.jamla.domain.port.out.SleeperPort;

import java.time.Duration;

public class ThreadSleeperAdapter implements SleeperPort {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }
}
