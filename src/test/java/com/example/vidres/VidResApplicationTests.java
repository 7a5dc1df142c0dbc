package com.example.vidres;

import com.example.vidres.service.CompletionPoller;
import com.example.vidres.service.LifecycleCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class VidResApplicationTests {

    @Autowired
    private LifecycleCoordinator lifecycleCoordinator;
    @Autowired
    private CompletionPoller completionPoller;

    @Test
    void contextLoads() {
        assertThat(lifecycleCoordinator).isNotNull();
        assertThat(completionPoller).isNotNull();
        assertThat(lifecycleCoordinator.status().inFlight()).isZero();
    }
}
