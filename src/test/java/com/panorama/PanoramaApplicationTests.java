package com.panorama;

import com.panorama.config.PanoramaProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "panorama.threads=2")
class PanoramaApplicationTests {

    @Autowired
    private PanoramaProperties properties;

    @Autowired
    @Qualifier("stitchingExecutor")
    private ExecutorService executor;

    @Test
    void contextLoads() {
        assertThat(properties.getFov()).isEqualTo(66.0);
        assertThat(properties.getThreads()).isEqualTo(2);
        assertThat(executor.isShutdown()).isFalse();
    }
}
